package org.wikidata.query.rdf.entitystore.storage;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.wikidata.query.rdf.entitystore.common.Config;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

/**
 * Builds MongoDB clients out of {@link Config}.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class MongoClientFactory {

    /**
     * How long to wait for a reachable server before failing an operation.
     */
    static final int SERVER_SELECTION_TIMEOUT_SECONDS = 30;

    private MongoClientFactory() {
    }

    public static MongoClient fromConfig() {
        return create(Config.mongoHost(), Config.mongoPort(), Config.MONGO_USERNAME, Config.MONGO_PASSWORD);
    }

    /**
     * @param user null to connect without authentication
     */
    public static MongoClient create(String host, int port, String user, String password) {
        return create(host, port, user, password, TimeUnit.SECONDS.toMillis(SERVER_SELECTION_TIMEOUT_SECONDS));
    }

    static MongoClient create(String host, int port, String user, String password, long serverSelectionTimeoutMillis) {
        MongoClientSettings.Builder settings = MongoClientSettings.builder()
            .applyToClusterSettings(cluster -> cluster
                .hosts(Collections.singletonList(new ServerAddress(host, port)))
                .serverSelectionTimeout(serverSelectionTimeoutMillis, TimeUnit.MILLISECONDS));
        if (user != null) {
            char[] secret = password == null ? new char[0] : password.toCharArray();
            settings.credential(MongoCredential.createCredential(user, Config.MONGO_AUTH_DATABASE, secret));
        }
        return MongoClients.create(settings.build());
    }
}
