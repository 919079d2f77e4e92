package com.example.gateway.session.dto;

import com.example.gateway.session.model.Contact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactsResponse {

    private int count;
    private List<Contact> contacts;

    public static ContactsResponse of(List<Contact> contacts) {
        return new ContactsResponse(contacts.size(), contacts);
    }
}
