package RFA;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import it.unimi.dsi.fastutil.ints.IntList;

public class RFACommandLine {
  public static void main(String[] args) {
    String filename = null;
    boolean postfix = false;
    boolean ba = false;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        Automaton.DEBUG = true;
      } else if ("--postfix".equalsIgnoreCase(arg)) {
        postfix = true;
      } else if ("--ba".equalsIgnoreCase(arg)) {
        ba = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit();
        }
        filename = args[++i];
      } else if (arg.startsWith("-")) {
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2 || positional.size() > 3) {
      printUsageAndExit();
    }
    String operation = positional.get(0).toLowerCase();
    String input = positional.get(1);
    String text = positional.size() == 3 ? positional.get(2) : "";

    try {
      long before = System.currentTimeMillis();
      Automaton automaton = load(input, postfix, ba);
      System.out.println(inputSizeLine(automaton));
      Automaton result = run(operation, automaton, text, System.out);
      long after = System.currentTimeMillis();
      System.out.println(operation + " duration: " + ((after - before) / 1000f) + "s");

      if (filename != null) {
        System.out.println("Writing to file: " + filename);
        BAFormat.writeFile(filename, result);
      }
    } catch (RuntimeException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "RFA [--debug] [--postfix] [--ba] [--writeBA <BA output file>] <operation> <input> [<text>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--postfix] : <input> is a postfix regex with explicit '.' concatenation");
    System.out.println("[--ba] : <input> is a finite automaton file in the BA format");
    System.out.println("[--writeBA <BA output file>] : Write the resulting automaton to specified output file");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  nfa: print the automaton as built.");
    System.out.println("  dfa: subset construction.");
    System.out.println("  minimal: minimal DFA.");
    System.out.println("  complete: DFA with a sink state for missing transitions.");
    System.out.println("  complement: DFA of the complement language over the same alphabet.");
    System.out.println("  regex: regular expression of the minimal DFA.");
    System.out.println("  prefix: length of the longest prefix of <text> in the language (-1 if none).");
    System.out.println("  accepts: whether <text> is in the language.");
    System.out.println();
    System.out.println("<input> : regular expression over letters with operators + . * ( ) and 1 for epsilon,");
    System.out.println("  e.g. \"(a+b)*c\".");
    System.exit(0);
  }

  static Automaton load(String input, boolean postfix, boolean ba) {
    if (ba) {
      return BAFormat.readFile(input);
    }
    return postfix ? Automaton.fromPostfix(input) : Automaton.fromRegex(input);
  }

  static String inputSizeLine(Automaton automaton) {
    return "Input automaton size: " + automaton.size();
  }

  /**
   * Run one operation and print its result.
   * @return the automaton the operation produced (or queried)
   */
  static Automaton run(String operation, Automaton automaton, String text, PrintStream out) {
    switch (operation) {
      case "regex" -> {
        Automaton minimal = automaton.getMinimal();
        out.println(minimal.toRegex());
        return minimal;
      }
      case "prefix" -> {
        out.println(automaton.containsPrefix(text));
        return automaton;
      }
      case "accepts" -> {
        out.println(automaton.accepts(text));
        return automaton;
      }
      default -> {
        Automaton result = applyOperation(operation, automaton);
        print(result, out);
        return result;
      }
    }
  }

  /**
   * Choose the transformation to run. The argument is left unchanged.
   */
  static Automaton applyOperation(String operation, Automaton automaton) {
    return switch (operation) {
      case "nfa" -> new Automaton(automaton);
      case "dfa" -> automaton.getDFA();
      case "minimal" -> automaton.getMinimal();
      case "complete" -> automaton.getComplete();
      case "complement" -> automaton.getComplement();
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    };
  }

  static void print(Automaton automaton, PrintStream out) {
    out.println("Number of states: " + automaton.size());
    for (State state : automaton.getStates()) {
      StringBuilder header = new StringBuilder("Id ").append(state.getId());
      if (state.isAccepting()) {
        header.append(" (f)");
      }
      if (state.getId() == automaton.getStart()) {
        header.append(" (s)");
      }
      out.println(header.append(':'));

      for (Map.Entry<Label, IntList> e : state.getTransitions().entrySet()) {
        StringBuilder line = new StringBuilder("  ").append(e.getKey()).append(" ->");
        for (int target : e.getValue()) {
          line.append(' ').append(target);
        }
        out.println(line);
      }
    }
  }
}
