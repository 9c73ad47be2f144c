package mailbridge.spi;

import mailbridge.model.Consumer;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for consumers. Identifiers are assigned by the store.
 */
public interface ConsumerStore {

    Consumer insert(Connection conn, String name);

    Optional<Consumer> find(Connection conn, int consumerId);

    /**
     * Returns all consumers ordered by id.
     */
    List<Consumer> findAll(Connection conn);

    /**
     * Deletes a consumer; its dispatch rows cascade.
     *
     * @return {@code true} if a row was deleted
     */
    boolean delete(Connection conn, int consumerId);
}
