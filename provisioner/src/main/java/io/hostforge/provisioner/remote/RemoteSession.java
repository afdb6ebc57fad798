package io.hostforge.provisioner.remote;

/** An open, authenticated session. Not thread-safe. */
public interface RemoteSession extends AutoCloseable {

    String username();

    int port();

    /**
     * Run one command and wait for it to finish. A non-zero exit status is
     * returned, not thrown.
     *
     * @throws RemoteCommandException when the channel breaks or the command
     *         outlives the command timeout
     */
    CommandResult execute(String command);

    @Override
    void close();
}
