package vkgraph.commands;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Asks the operator for a value that was not supplied through options, env or properties. */
@FunctionalInterface
public interface Prompter {

    String ask(String label, boolean secret);

    static Prompter console() {
        return (label, secret) -> {
            Console console = System.console();
            if (console != null) {
                if (secret) {
                    char[] chars = console.readPassword("%s: ", label);
                    return chars == null ? "" : new String(chars).trim();
                }
                String line = console.readLine("%s: ", label);
                return line == null ? "" : line.trim();
            }
            System.out.print(label + ": ");
            System.out.flush();
            try {
                String line = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
                return line == null ? "" : line.trim();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + label, e);
            }
        };
    }

    /** Returns {@code current} unless blank, otherwise prompts. */
    default String orAsk(String current, String label, boolean secret) {
        if (current != null && !current.isBlank()) return current;
        return ask(label, secret);
    }
}
