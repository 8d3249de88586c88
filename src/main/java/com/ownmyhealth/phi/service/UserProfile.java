package com.ownmyhealth.phi.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Decrypted profile PHI. Lives only in memory for the duration of a request.
 */
public record UserProfile(String firstName, String lastName, String dateOfBirth, String phone, String address) {

    Map<String, Object> toEncryptableFields() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("firstNameEncrypted", this.firstName);
        fields.put("lastNameEncrypted", this.lastName);
        fields.put("dateOfBirthEncrypted", this.dateOfBirth);
        fields.put("phoneEncrypted", this.phone);
        fields.put("addressEncrypted", this.address);
        return fields;
    }

    static UserProfile fromDecryptedFields(Map<String, Object> fields) {
        return new UserProfile(text(fields, "firstNameEncrypted"), text(fields, "lastNameEncrypted"),
                text(fields, "dateOfBirthEncrypted"), text(fields, "phoneEncrypted"), text(fields, "addressEncrypted"));
    }

    private static String text(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        return value instanceof String s && !s.isEmpty() ? s : null;
    }

    @Override
    public String toString() {
        return "UserProfile[REDACTED]";
    }
}
