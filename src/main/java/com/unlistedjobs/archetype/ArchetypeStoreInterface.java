package com.unlistedjobs.archetype;

import java.util.List;

/**
 * Durable keyed storage for final archetype records.
 * <p>
 * Every write is a full replace keyed by {@link Archetype#naturalKey()}, so re-running a batch is safe.
 */
public interface ArchetypeStoreInterface {
    /**
     * Creates the archetype table and its natural-key constraint if they don't already exist.
     */
    void createTables();

    /**
     * Upserts a group of archetypes atomically: either all are written or none.
     * @param archetypes records of one cell
     * @return number of records written
     * @throws EstimationException with {@link ErrorKind#PERSISTENCE_FAILURE} if the write fails
     */
    int upsertAll(List<Archetype> archetypes);

    /**
     * Replaces every stored record of one tier with the given records, atomically.
     * @param recordType tier to replace
     * @param archetypes new contents of that tier
     * @return number of records written
     * @throws EstimationException with {@link ErrorKind#PERSISTENCE_FAILURE} if the write fails
     */
    int replaceTier(RecordType recordType, List<Archetype> archetypes);

    /**
     * Loads every stored record of one tier.
     * @param recordType tier to load
     * @return stored records
     */
    List<Archetype> loadTier(RecordType recordType);
}
