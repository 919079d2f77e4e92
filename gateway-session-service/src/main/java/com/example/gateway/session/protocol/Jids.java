package com.example.gateway.session.protocol;

import com.example.gateway.shared.exception.ValidationException;

/**
 * Network addresses (JIDs) of chat partners.
 */
public final class Jids {

    public static final String USER_SUFFIX = "@s.whatsapp.net";
    public static final String STATUS_BROADCAST = "status@broadcast";

    private Jids() {
    }

    /**
     * A value that already contains {@code @} is taken as a full JID. Anything else is read as a
     * phone number: non-digits are dropped and the user suffix appended.
     *
     * @throws ValidationException if a phone number has no digits
     */
    public static String normalize(String to) {
        if (to == null || to.isBlank()) {
            throw new ValidationException("to is required");
        }
        String trimmed = to.trim();
        if (trimmed.contains("@")) {
            return trimmed;
        }
        String digits = trimmed.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            throw new ValidationException("to must be a phone number or a JID: " + to);
        }
        return digits + USER_SUFFIX;
    }

    /** Stories posted by contacts; never a chat of its own. */
    public static boolean isStatusBroadcast(String jid) {
        return STATUS_BROADCAST.equals(jid);
    }
}
