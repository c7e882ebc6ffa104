package io.storagerouter.cli;

/** Entry point for the {@code storage-router} executable jar. */
public final class RouterMain {

    private RouterMain() {}

    public static void main(String[] args) {
        int exitCode = RouterCommand.newCommandLine(new RouterCommand()).execute(args);
        System.exit(exitCode);
    }
}
