package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.model.User;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.data.mongodb.core.query.Update;

/**
 * Bridges the encrypted profile columns of {@link User} and the field-map form
 * used by the batch encryption calls. Keys are the names in {@code PhiFields.USER}.
 */
final class ProfileFields {

    private ProfileFields() {
    }

    static Map<String, Object> read(User user) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("firstNameEncrypted", user.getFirstNameEncrypted());
        fields.put("lastNameEncrypted", user.getLastNameEncrypted());
        fields.put("dateOfBirthEncrypted", user.getDateOfBirthEncrypted());
        fields.put("phoneEncrypted", user.getPhoneEncrypted());
        fields.put("addressEncrypted", user.getAddressEncrypted());
        return fields;
    }

    static void write(User user, Map<String, Object> fields) {
        user.setFirstNameEncrypted((String) fields.get("firstNameEncrypted"));
        user.setLastNameEncrypted((String) fields.get("lastNameEncrypted"));
        user.setDateOfBirthEncrypted((String) fields.get("dateOfBirthEncrypted"));
        user.setPhoneEncrypted((String) fields.get("phoneEncrypted"));
        user.setAddressEncrypted((String) fields.get("addressEncrypted"));
    }

    /**
     * Store update touching only the profile columns; absent values are unset.
     */
    static Update toUpdate(Map<String, Object> fields) {
        Update update = new Update();
        for (String column : read(new User()).keySet()) {
            Object value = fields.get(column);
            if (value == null) {
                update.unset(column);
            } else {
                update.set(column, value);
            }
        }
        return update;
    }
}
