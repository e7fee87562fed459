package io.roomchat.cli;

@FunctionalInterface
public interface ServerRunner {
    int run(String hostOverride, Integer portOverride) throws Exception;
}
