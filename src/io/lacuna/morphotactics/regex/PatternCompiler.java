package io.lacuna.morphotactics.regex;

import io.lacuna.bifurcan.LinearList;
import io.lacuna.morphotactics.automaton.Automaton;
import io.lacuna.morphotactics.automaton.Tropical;

/**
 * Compiles stem patterns into acceptors: fragments whose every arc has the same input and output symbol.
 */
public final class PatternCompiler {

  private PatternCompiler() {
  }

  /**
   * @return an acceptor for {@code pattern}, a fragment with a single entry and exit
   * @throws PatternException if {@code pattern} is malformed
   */
  public static Automaton compile(String pattern, Alphabet alphabet) {
    return compile(PatternParser.parse(pattern, alphabet), alphabet);
  }

  public static Automaton compile(Node node, Alphabet alphabet) {
    switch (node.kind) {
      case LITERAL:
        return Automaton.literal(node.symbol, node.symbol, Tropical.ONE);

      case CONCAT: {
        Automaton result = null;
        for (Node child : node.children) {
          Automaton a = compile(child, alphabet);
          result = result == null ? a : Automaton.concat(result, a);
        }
        return result == null ? Automaton.epsilon() : result;
      }

      case UNION: {
        LinearList<Automaton> branches = new LinearList<>();
        node.children.forEach(child -> branches.addLast(compile(child, alphabet)));
        return Automaton.union(branches);
      }

      case OPTIONAL:
        return Automaton.optional(compile(node.child(), alphabet));

      case STAR:
        return Automaton.star(compile(node.child(), alphabet));

      case PLUS:
        return Automaton.plus(compile(node.child(), alphabet));

      case WILDCARD: {
        if (alphabet.isEmpty()) {
          throw new IllegalStateException("cannot compile a wildcard without an alphabet");
        }
        LinearList<Automaton> branches = new LinearList<>();
        alphabet.symbols().forEach(s -> branches.addLast(Automaton.literal(s, s, Tropical.ONE)));
        return Automaton.union(branches);
      }

      default:
        throw new IllegalStateException("unexpected node " + node.kind);
    }
  }
}
