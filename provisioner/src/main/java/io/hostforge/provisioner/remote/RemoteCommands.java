package io.hostforge.provisioner.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Small helpers shared by every step that runs commands on a host. */
public final class RemoteCommands {

    private static final Logger log = LoggerFactory.getLogger(RemoteCommands.class);

    private RemoteCommands() {}

    /** Run {@code command}; a non-zero exit becomes a {@link RemoteCommandException}. */
    public static CommandResult runChecked(RemoteSession session, String description, String command) {
        log.debug("[{}@{}] {}", session.username(), session.port(), description);
        CommandResult result = session.execute(command);
        if (!result.succeeded()) {
            throw new RemoteCommandException(description, result);
        }
        return result;
    }

    /** Run {@code command} and report only whether it exited 0. */
    public static boolean test(RemoteSession session, String command) {
        return session.execute(command).succeeded();
    }

    /** POSIX single-quote a value for use inside a shell command. */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
