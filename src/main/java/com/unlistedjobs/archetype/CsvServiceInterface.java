package com.unlistedjobs.archetype;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Interface for the file inputs and outputs of a batch run.
 */
public interface CsvServiceInterface {
    /**
     * Reads the raw evidence rows ({@value CsvService#EVIDENCE_FILE}).
     * @return evidence rows
     * @throws IOException if the file cannot be read
     */
    List<EvidenceRow> loadEvidence() throws IOException;

    /**
     * Reads the externally produced observed tier ({@value CsvService#OBSERVED_FILE}); empty if the file is absent.
     * @return observed archetypes
     * @throws IOException if the file cannot be read
     */
    List<Archetype> loadObservedArchetypes() throws IOException;

    /**
     * Reads establishment classes ({@value CsvService#ESTABLISHMENTS_FILE}); empty if the file is absent.
     * @return establishment classes
     * @throws IOException if the file cannot be read
     */
    List<CbpEstablishment> loadEstablishments() throws IOException;

    /**
     * Reads the industry to canonical-role employment mix, from the data directory or the bundled default.
     * @return industry -> (canonical role id -> share)
     * @throws IOException if the document cannot be read
     */
    Map<String, Map<Integer, Double>> loadRoleMix() throws IOException;

    /**
     * Writes archetypes of all tiers to {@value CsvService#ARCHETYPES_FILE} in the output directory.
     * @param archetypes records to export
     * @throws IOException if file writing fails
     */
    void writeArchetypes(List<Archetype> archetypes) throws IOException;

    /**
     * Writes salary estimates to {@value CsvService#SALARY_ESTIMATES_FILE} in the output directory.
     * @param estimates records to export
     * @throws IOException if file writing fails
     */
    void writeSalaryEstimates(List<SalaryEstimate> estimates) throws IOException;
}
