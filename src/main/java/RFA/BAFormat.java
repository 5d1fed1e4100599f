package RFA;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * BA text format (as used by RABIT), read and written through AutomataLib.
 * The format has no epsilon transitions: automata are determinized before writing.
 */
public class BAFormat {

    public static Automaton read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        return CompactConversions.fromCompactNFA(automaton);
    }

    public static void write(Automaton automaton, OutputStream os) throws IOException {
        final CompactDFA<Character> dfa = CompactConversions.toCompactDFA(automaton);
        new BAWriter<Character>().writeModel(os, dfa, dfa.getInputAlphabet());
    }

    static Automaton readFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (IOException | FormatException ex) {
            throw new RuntimeException(ex);
        }
    }

    static void writeFile(String filename, Automaton automaton) {
        try (OutputStream os = new FileOutputStream(filename)) {
            write(automaton, os);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
