package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Wizard sessions, one JSON file each under {@code <project>/.hostforge/wizard/}.
 */
@Component
public class SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(SessionRepository.class);

    static final String SESSION_DIR = ".hostforge/wizard";

    private final JsonDocumentStore store;

    public SessionRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public void save(Session session) {
        session.touch();
        store.write(fileFor(Path.of(session.getProjectPath()), session.getId()), session);
    }

    public Optional<Session> findById(Path projectPath, String sessionId) {
        return store.read(fileFor(projectPath, sessionId), Session.class);
    }

    /** All readable sessions of the project. Unreadable files are logged and left alone. */
    public List<Session> listSessions(Path projectPath) {
        Path dir = sessionDir(projectPath);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Session> sessions = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files.filter(f -> f.toString().endsWith(".json"))::iterator) {
                try {
                    store.read(file, Session.class).ifPresent(sessions::add);
                } catch (StateStoreException e) {
                    log.warn("Ignoring unreadable session file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Could not list sessions", dir, e);
        }
        return sessions;
    }

    /** The session touched most recently, completed or not. */
    public Optional<Session> findMostRecent(Path projectPath) {
        return listSessions(projectPath).stream()
                .max(Comparator.comparing(Session::getUpdatedAt));
    }

    public Path sessionDir(Path projectPath) {
        return projectPath.resolve(SESSION_DIR);
    }

    Path fileFor(Path projectPath, String sessionId) {
        if (sessionId == null || !ProvisioningStateRepository.SAFE_ID.matcher(sessionId).matches()
                || sessionId.startsWith(".")) {
            throw new ConfigurationException("Invalid session id: '" + sessionId + "'",
                    "Pass the id printed by 'hostforge new', or omit it to resume the most recent session.");
        }
        return sessionDir(projectPath).resolve(sessionId + ".json");
    }
}
