package io.hostforge.provisioner.recovery;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Numbered menus on the terminal.
 *
 * When input ends (non-interactive runs) the safe choice is taken: save and
 * exit, or return from recovery mode.
 */
@Component
public class ConsoleDecisionSource implements DecisionSource {

    private final BufferedReader in;
    private final PrintWriter    out;

    @Autowired
    public ConsoleDecisionSource() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
             new PrintWriter(System.out, true));
    }

    public ConsoleDecisionSource(BufferedReader in, PrintWriter out) {
        this.in  = in;
        this.out = out;
    }

    @Override
    public RecoveryAction decide(FailureContext context) {
        List<RecoveryAction> choices = new ArrayList<>();
        for (RecoveryAction action : RecoveryAction.values()) {
            if (context.offered().contains(action)) choices.add(action);
        }
        out.println("What would you like to do?");
        for (int i = 0; i < choices.size(); i++) {
            out.printf("  %d) %s%n", i + 1, choices.get(i).label());
        }
        Integer choice = readChoice(choices.size());
        if (choice == null) {
            return context.offered().contains(RecoveryAction.SAVE_AND_EXIT)
                    ? RecoveryAction.SAVE_AND_EXIT : RecoveryAction.CANCEL;
        }
        return choices.get(choice - 1);
    }

    @Override
    public RecoveryModeAction decideRecoveryMode(FailureContext context) {
        RecoveryModeAction[] choices = RecoveryModeAction.values();
        out.println("Recovery mode for '" + context.stepName() + "':");
        for (int i = 0; i < choices.length; i++) {
            out.printf("  %d) %s%n", i + 1, choices[i].label());
        }
        Integer choice = readChoice(choices.length);
        return choice == null ? RecoveryModeAction.RETURN : choices[choice - 1];
    }

    @Override
    public void show(String text) {
        out.println(text);
    }

    // null on end of input
    private Integer readChoice(int max) {
        while (true) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (line == null) return null;
            String answer = line.trim();
            if (answer.matches("\\d{1,3}")) {
                int n = Integer.parseInt(answer);
                if (n >= 1 && n <= max) return n;
            }
            out.println("Enter a number between 1 and " + max + ".");
        }
    }
}
