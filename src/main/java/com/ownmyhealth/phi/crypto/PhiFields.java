package com.ownmyhealth.phi.crypto;

import java.util.List;
import java.util.Map;

/**
 * Names of the encrypted fields per record type. Callers of
 * {@link EncryptionService#encryptFields} and {@link EncryptionService#decryptFields}
 * take their field lists from here.
 */
public final class PhiFields {
    public static final List<String> USER = List.of(
            "firstNameEncrypted", "lastNameEncrypted", "dateOfBirthEncrypted", "phoneEncrypted", "addressEncrypted");
    public static final List<String> BIOMARKER = List.of("valueEncrypted", "notesEncrypted");
    public static final List<String> BIOMARKER_HISTORY = List.of("valueEncrypted", "notesEncrypted");
    public static final List<String> INSURANCE_PLAN = List.of("memberIdEncrypted", "groupIdEncrypted");
    public static final List<String> DNA_DATA = List.of("rawDataPathEncrypted");
    public static final List<String> DNA_VARIANT = List.of("genotypeEncrypted");
    public static final List<String> GENETIC_TRAIT = List.of("descriptionEncrypted", "recommendationsEncrypted");
    public static final List<String> HEALTH_NEED = List.of("descriptionEncrypted", "notesEncrypted", "actionPlanEncrypted");
    public static final List<String> AUDIT_LOG = List.of("previousValueEncrypted", "newValueEncrypted");

    private static final Map<String, List<String>> BY_RECORD_TYPE = Map.of(
            "User", USER,
            "Biomarker", BIOMARKER,
            "BiomarkerHistory", BIOMARKER_HISTORY,
            "InsurancePlan", INSURANCE_PLAN,
            "DNAData", DNA_DATA,
            "DNAVariant", DNA_VARIANT,
            "GeneticTrait", GENETIC_TRAIT,
            "HealthNeed", HEALTH_NEED,
            "AuditLog", AUDIT_LOG);

    private PhiFields() {
    }

    /**
     * Field list for a record type name, empty when the type carries no PHI.
     */
    public static List<String> forRecordType(String recordType) {
        return BY_RECORD_TYPE.getOrDefault(recordType, List.of());
    }
}
