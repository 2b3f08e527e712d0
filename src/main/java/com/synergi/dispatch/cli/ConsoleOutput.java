package com.synergi.dispatch.cli;

import com.synergi.core.model.SettlementRecord;
import com.synergi.core.model.StepOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Synergi CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) SYNERGI v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SYNERGI]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void step(StepOutcome outcome) {
        String status = switch (outcome.status()) {
            case SUCCESS -> "@|fg(green) SUCCESS |@";
            case DEGRADED -> "@|fg(yellow) DEGRADED|@";
            case REJECTED -> "@|fg(red) REJECTED|@";
            case ERROR -> "@|fg(red) ERROR   |@";
        };
        String worker = outcome.workerId() != null ? outcome.workerId() : "-";
        StringBuilder line = new StringBuilder()
                .append("  @|fg(blue) [STEP ").append(outcome.index() + 1).append("]|@ ")
                .append(status).append(' ')
                .append(outcome.capabilityId()).append(" -> ").append(worker);
        if (outcome.selfHealed()) {
            line.append(" (healed from ").append(outcome.originalWorkerId()).append(')');
        }
        if (outcome.settlement() != null) {
            line.append(" paid ").append(outcome.settlement().amount().toPlainString());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
        if (outcome.error() != null) {
            System.out.println("      " + outcome.error());
        } else if (outcome.rationale() != null) {
            System.out.println("      " + outcome.rationale());
        }
        for (SettlementRecord hire : outcome.nestedHires()) {
            payment(hire);
        }
        for (String refused : outcome.refusedHires()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "      @|fg(red) refused|@ " + refused));
        }
    }

    public static void payment(SettlementRecord record) {
        String indent = "  ".repeat(record.depth() + 2);
        String tag = record.delegated() ? "@|fg(magenta) [HIRE]|@ " : "@|fg(yellow) [PAY]|@ ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + tag + record.payerId() + " -> " + record.workerId()
                        + " " + record.amount().toPlainString()
                        + " (" + record.capabilityId() + ", tx " + record.transactionId() + ")"));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "step" -> "@|fg(blue) [STEP]|@";
            case "payment" -> "@|fg(yellow) [PAYMENT]|@";
            case "delegated-hire" -> "@|fg(magenta) [HIRE]|@";
            case "done" -> "@|fg(green),bold [DONE]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }
}
