package com.ryuqq.roompeek.adapter.inmemory.directory;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.spi.DirectoryLookup;
import com.ryuqq.roompeek.core.spi.DirectoryLookupException;
import com.ryuqq.roompeek.core.spi.DirectoryLookupRequest;
import com.ryuqq.roompeek.core.spi.DirectoryLookupResponse;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link DirectoryLookup} simulating remote directories.
 *
 * <p>Each registered server holds its own alias directory. A lookup against a server
 * that was never registered fails with {@link DirectoryLookupException}, the way an
 * unreachable server would. An unknown alias on a registered server yields
 * {@link DirectoryLookupResponse#notFound()}.</p>
 *
 * <p>Every request is recorded so tests can assert on call counts.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class InMemoryDirectoryLookup implements DirectoryLookup {

    private final ConcurrentHashMap<String, Map<String, DirectoryLookupResponse>> directories;
    private final List<DirectoryLookupRequest> requests;

    public InMemoryDirectoryLookup() {
        this.directories = new ConcurrentHashMap<>();
        this.requests = new CopyOnWriteArrayList<>();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public DirectoryLookupResponse lookup(PeekContext context, DirectoryLookupRequest request) {
        Objects.requireNonNull(context, "context");
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        context.throwIfDone();
        requests.add(request);

        Map<String, DirectoryLookupResponse> directory = directories.get(request.serverName());
        if (directory == null) {
            throw new DirectoryLookupException("server " + request.serverName() + " is unreachable");
        }
        return directory.getOrDefault(request.roomAlias(), DirectoryLookupResponse.notFound());
    }

    /**
     * Registers a server with an empty directory.
     *
     * @param serverName the server name
     */
    public void registerServer(String serverName) {
        directories.computeIfAbsent(serverName, k -> new ConcurrentHashMap<>());
    }

    /**
     * Publishes an alias on a server's directory, registering the server if needed.
     *
     * @param serverName the server that owns the alias
     * @param roomAlias the alias
     * @param roomId the room ID it resolves to
     * @param serverNames servers in the room, in preference order
     */
    public void publish(String serverName, String roomAlias, String roomId, List<String> serverNames) {
        directories.computeIfAbsent(serverName, k -> new ConcurrentHashMap<>())
            .put(roomAlias, new DirectoryLookupResponse(roomId, serverNames));
    }

    /**
     * Returns the requests received so far, in order.
     *
     * @return snapshot of received requests
     */
    public List<DirectoryLookupRequest> requests() {
        return List.copyOf(requests);
    }

    /**
     * Clears all directories and recorded requests. Used for test cleanup.
     */
    public void clear() {
        directories.clear();
        requests.clear();
    }
}
