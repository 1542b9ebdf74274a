package com.dietwatch.search.exception;

public class SyncPermanentFailureException extends SearchEngineException {

    private final String entityId;
    private final int attempts;

    public SyncPermanentFailureException(String entityId, int attempts, String lastError) {
        super("sync permanently failed entity_id=" + entityId + " attempts=" + attempts + " last_error=" + lastError);
        this.entityId = entityId;
        this.attempts = attempts;
    }

    public String getEntityId() {
        return entityId;
    }

    public int getAttempts() {
        return attempts;
    }
}
