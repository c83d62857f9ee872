package com.scalarset;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class Main {

    private static final Pattern INTEGER_TOKEN = Pattern.compile("-?[0-9]+");

    public static void main(String[] args) {
        if (args.length == 0) {
            runDemo();
            System.out.println("\n--- Usage ---");
            printUsage();
            return;
        }

        if (args.length < 2) {
            System.err.println("Error: Insufficient arguments (need an operation and at least one set)");
            printUsage();
            System.exit(1);
        }

        try {
            System.out.println(evaluate(args));
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Applies the operation named by {@code args[0]} to the sets given in the remaining arguments.
     *
     * @return the printable result
     * @throws IllegalArgumentException if the operation is unknown or has the wrong number of sets
     */
    static String evaluate(String[] args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("Need an operation and at least one set");
        }
        String op = args[0].toLowerCase(Locale.ROOT);
        List<ScalarSet> sets = parseSetsFromArgs(args);

        switch (op) {
            case "union":
                return ScalarSet.unionAll(sets).toString();
            case "intersect":
                return intersectAll(sets).toString();
            case "diff":
                ScalarSet difference = ScalarSet.copyOf(sets.get(0));
                for (int i = 1; i < sets.size(); i++) {
                    difference.removeAll(sets.get(i));
                }
                return difference.toString();
            case "equals":
                requireSetCount(op, sets, 2);
                return String.valueOf(sets.get(0).equals(sets.get(1)));
            case "contains":
                requireSetCount(op, sets, 2);
                return String.valueOf(sets.get(0).containsAll(sets.get(1)));
            default:
                throw new IllegalArgumentException("Unknown operation: " + args[0]);
        }
    }

    /**
     * Parses a comma separated list. Tokens that are integers become {@link Integer}, the rest {@link String}.
     * An empty argument is the empty set.
     */
    static ScalarSet parseSet(String arg) {
        ScalarSet set = new ScalarSet();
        if (arg.isEmpty()) {
            return set;
        }
        for (String token : arg.split(",", -1)) {
            set.add(parseElement(token.trim()));
        }
        return set;
    }

    /**
     * Only an optional '-' followed by digits is an integer; "+5", "5a" or an
     * out-of-range number stay strings.
     */
    static Object parseElement(String token) {
        if (!INTEGER_TOKEN.matcher(token).matches()) {
            return token;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            // too large for an int
            return token;
        }
    }

    private static ScalarSet intersectAll(List<ScalarSet> sets) {
        ScalarSet result = ScalarSet.copyOf(sets.get(0));
        for (int i = 1; i < sets.size(); i++) {
            result.retainAll(sets.get(i));
        }
        return result;
    }

    private static void requireSetCount(String op, List<ScalarSet> sets, int expected) {
        if (sets.size() != expected) {
            throw new IllegalArgumentException(
                "Operation '" + op + "' needs exactly " + expected + " sets, got " + sets.size());
        }
    }

    private static List<ScalarSet> parseSetsFromArgs(String[] args) {
        List<ScalarSet> sets = new ArrayList<>();

        // Format: <op> <set1> [<set2> ...]
        for (int i = 1; i < args.length; i++) {
            sets.add(parseSet(args[i]));
        }

        return sets;
    }

    private static void runDemo() {
        System.out.println("=== Scalar Set Demo ===\n");

        ScalarSet set = new ScalarSet(List.of("foo", "bar", "baz", 9000, "foo"));
        System.out.println("Created from [foo, bar, baz, 9000, foo]: " + set);
        System.out.println("  size: " + set.size() + " (duplicates collapse)");

        // Indexed access
        ScalarSet indexed = new ScalarSet();
        indexed.set(0, true);
        indexed.set(-900, true);
        indexed.set(0, false);
        indexed.set("set", true);
        indexed.set("noset", false);
        System.out.println("\nIndexed writes 0=true, -900=true, 0=false, set=true, noset=false:");
        System.out.println("  Result: " + indexed);

        // Set algebra
        ScalarSet a = new ScalarSet(List.of(100, 200));
        ScalarSet b = new ScalarSet(List.of(200, 300));
        System.out.println("\nA = " + a + ", B = " + b);
        System.out.println("  union:     " + ScalarSet.unionAll(List.of(a, b)));
        System.out.println("  intersect: " + ScalarSet.intersect(a, b));
        ScalarSet difference = ScalarSet.copyOf(a);
        difference.removeAll(b);
        System.out.println("  A - B:     " + difference);

        // Iteration with synthetic positions
        System.out.println("\nIteration:");
        for (OrderedKeyIterator it = set.iterator(); it.valid(); it.advance()) {
            System.out.printf("  %d => %s%n", it.position(), it.current());
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar scalar-set.jar <op> <set1> [<set2> ...]");
        System.out.println();
        System.out.println("Operations: union, intersect, diff, equals, contains");
        System.out.println("Sets are comma separated. Tokens of digits with an optional leading '-' are integers,");
        System.out.println("everything else (including \"+5\") is a string.");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar scalar-set.jar union 1,2,3 3,4");
        System.out.println("  java -jar scalar-set.jar intersect 100,200 200,300");
        System.out.println("  java -jar scalar-set.jar contains a,b,c b");
        System.out.println();
        System.out.println("Run without arguments to see demo.");
    }
}
