package ai.turnloom.store;

/**
 * The database was written by a newer build. Opening it is refused so newer data is never rewritten by older code.
 */
public final class SchemaVersionException extends StoreException {
    private final int databaseVersion;
    private final int supportedVersion;

    public SchemaVersionException(int databaseVersion, int supportedVersion) {
        super("sqlite schema version is newer than this build: db=" + databaseVersion + ", app=" + supportedVersion);
        this.databaseVersion = databaseVersion;
        this.supportedVersion = supportedVersion;
    }

    public int databaseVersion() {
        return databaseVersion;
    }

    public int supportedVersion() {
        return supportedVersion;
    }
}
