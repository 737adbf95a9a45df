package org.wikidata.query.rdf.entitystore.common;

/**
 * A set of configuration constants used by the entity store tools.
 * Connection parameters are passed through the environment variables listed below.
 * <ul>
 * <li>{@code MONGO_ENDPOINT}: MongoDB host and port, e.g., {@code localhost:27017};</li>
 * <li>{@code MONGO_INITDB_ROOT_USERNAME}: MongoDB user name, optional;</li>
 * <li>{@code MONGO_INITDB_ROOT_PASSWORD}: MongoDB password, optional;</li>
 * <li>{@code WIKIDATA_SPARQL_ENDPOINT}: SPARQL endpoint used to resolve the taxonomy,
 * e.g., {@code https://query.wikidata.org/sparql};</li>
 * <li>{@code LAMAPI_TOKEN}: access token expected by the lookup API.</li>
 * </ul>
 * Run-level parameters such as the batch size or the number of workers are command line options,
 * see {@link org.wikidata.query.rdf.entitystore.ingestion.DumpOptions}.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class Config {

    public static final String MONGO_ENDPOINT = env("MONGO_ENDPOINT", "localhost:27017");
    public static final String MONGO_USERNAME = env("MONGO_INITDB_ROOT_USERNAME", null);
    public static final String MONGO_PASSWORD = env("MONGO_INITDB_ROOT_PASSWORD", null);
    /**
     * Authentication database of the root user created by the MongoDB image.
     */
    public static final String MONGO_AUTH_DATABASE = "admin";
    /**
     * Database holding the error log, shared by every run.
     */
    public static final String ERROR_LOG_DATABASE = "wikidata";
    public static final String ERROR_LOG_COLLECTION = "log";
    public static final String SPARQL_ENDPOINT = env("WIKIDATA_SPARQL_ENDPOINT", "https://query.wikidata.org/sparql");
    /**
     * The Wikidata Query Service rejects clients without a descriptive user agent.
     */
    public static final String USER_AGENT = "wikidata-entity-store/0.1 (https://www.wikidata.org/wiki/User:Entity_store)";
    public static final String LOOKUP_ACCESS_TOKEN = env("LAMAPI_TOKEN", null);

    private Config() {
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    /**
     * @return the host part of {@link #MONGO_ENDPOINT}
     */
    public static String mongoHost() {
        int colon = MONGO_ENDPOINT.lastIndexOf(':');
        return colon < 0 ? MONGO_ENDPOINT : MONGO_ENDPOINT.substring(0, colon);
    }

    /**
     * @return the port part of {@link #MONGO_ENDPOINT}, {@code 27017} if there is none
     */
    public static int mongoPort() {
        int colon = MONGO_ENDPOINT.lastIndexOf(':');
        return colon < 0 ? 27017 : Integer.parseInt(MONGO_ENDPOINT.substring(colon + 1));
    }
}
