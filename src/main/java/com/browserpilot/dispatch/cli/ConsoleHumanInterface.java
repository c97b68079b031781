package com.browserpilot.dispatch.cli;

import com.browserpilot.core.human.HumanInterface;
import com.browserpilot.core.model.Interrupt;
import com.browserpilot.core.model.InterruptKind;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Asks questions on the terminal. An answer may be the option text, its 1-based
 * number, or {@code y}/{@code n} for yes/no questions.
 */
@Component
public class ConsoleHumanInterface implements HumanInterface {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleHumanInterface() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsoleHumanInterface(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String ask(String prompt, List<String> options) {
        ConsoleOutput.question(new Interrupt(InterruptKind.QUESTION, prompt, options, null));
        while (true) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read answer", e);
            }
            if (line == null) {
                // end of input counts as a refusal
                return options.contains("no") ? "no" : "";
            }
            String answer = normalize(line.trim(), options);
            if (answer != null) {
                return answer;
            }
            out.println("Please answer with one of: " + String.join(", ", options));
        }
    }

    /**
     * @return the chosen option, the free text when there are no options, or null if invalid
     */
    static String normalize(String line, List<String> options) {
        if (options.isEmpty()) {
            return line.isEmpty() ? null : line;
        }
        for (String option : options) {
            if (option.equalsIgnoreCase(line)) return option;
        }
        if (line.matches("\\d{1,4}")) {
            int index = Integer.parseInt(line);
            if (index >= 1 && index <= options.size()) return options.get(index - 1);
        }
        String lower = line.toLowerCase(Locale.ROOT);
        if (options.contains("yes") && lower.equals("y")) return "yes";
        if (options.contains("no") && lower.equals("n")) return "no";
        return null;
    }
}
