package com.podium.cli;

import com.podium.cli.shell.MarketShell;
import com.podium.cli.tools.ConfigDoctor;
import com.podium.cli.tools.CurveTool;
import com.podium.cli.tools.QuoteTool;

import java.util.Arrays;

public class Main {

    public static void main(String[] args) {
        if (args.length == 0) {
            printHelp();
            return;
        }

        String cmd = args[0].trim().toLowerCase();
        String[] tail = Arrays.copyOfRange(args, 1, args.length);

        switch (cmd) {
            case "curve":
                System.exit(CurveTool.run(tail));
                return;

            case "quote":
                System.exit(QuoteTool.run(tail));
                return;

            case "validate-config":
            case "doctor":
                System.exit(ConfigDoctor.run(tail));
                return;

            case "shell":
                System.exit(MarketShell.run(tail));
                return;

            case "help":
            case "--help":
            case "-h":
                printHelp();
                return;

            default:
                System.err.println("Unknown command: " + cmd);
                printHelp();
                System.exit(2);
        }
    }

    private static void printHelp() {
        System.out.println("Podium CLI");
        System.out.println("Usage:");
        System.out.println("  java -jar podium-cli.jar curve [--from N] [--count N] [--weights a,b,c]");
        System.out.println("  java -jar podium-cli.jar quote <supply> <amount> [--referrer] [--weights a,b,c]");
        System.out.println("  java -jar podium-cli.jar validate-config [--profile p] [--full] [--json]");
        System.out.println("  java -jar podium-cli.jar shell [--admin addr] [--treasury addr]");
    }
}
