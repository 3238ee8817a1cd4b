package io.lacuna.morphotactics.regex;

import org.junit.Test;

import static io.lacuna.morphotactics.regex.AlphabetTests.NAHUATL;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

/**
 * Tests for {@link PatternParser}.
 */
public class PatternParserTests {

  private static final Alphabet SMALL = Alphabet.builder()
          .add("C", "p", "t")
          .add("V", "a")
          .build();

  private static PatternException failure(String pattern, Alphabet alphabet) {
    try {
      PatternParser.parse(pattern, alphabet);
    } catch (PatternException e) {
      return e;
    }
    fail("expected '" + pattern + "' to be rejected");
    return null;
  }

  @Test
  public void literalsWithoutAnAlphabetAreSingleCharacters() {
    Node n = PatternParser.parse("ab", Alphabet.empty());

    assertThat(n.kind, is(Node.Kind.CONCAT));
    assertThat(n.children.size(), is(2L));
    assertThat(n.children.nth(0).symbol, is("a"));
  }

  @Test
  public void classesBecomeUnionsOfTheirSymbols() {
    Node n = PatternParser.parse("C", SMALL);

    assertThat(n.kind, is(Node.Kind.UNION));
    assertThat(n.toString(), is("[p t]"));
  }

  @Test
  public void singletonClassesBecomeLiterals() {
    assertThat(PatternParser.parse("V", SMALL).kind, is(Node.Kind.LITERAL));
  }

  @Test
  public void quantifiersApplyToThePrecedingAtom() {
    Node n = PatternParser.parse("[CV]*V", SMALL);

    assertThat(n.kind, is(Node.Kind.CONCAT));
    assertThat(n.children.nth(0).kind, is(Node.Kind.STAR));
    assertThat(n.children.nth(0).child().kind, is(Node.Kind.UNION));
    assertThat(n.toString(), is("([[p t] a]*a)"));
  }

  @Test
  public void quantifiersApplyToGroups() {
    Node n = PatternParser.parse("p(at)+", SMALL);

    assertThat(n.children.nth(1).kind, is(Node.Kind.PLUS));
    assertThat(n.children.nth(1).child().kind, is(Node.Kind.CONCAT));
  }

  @Test
  public void quantifiersStack() {
    Node n = PatternParser.parse("a?*", Alphabet.empty());

    assertThat(n.kind, is(Node.Kind.STAR));
    assertThat(n.child().kind, is(Node.Kind.OPTIONAL));
  }

  @Test
  public void multiCharacterSymbolsAreReadWhole() {
    Node n = PatternParser.parse("kwatl", NAHUATL);

    assertThat(n.toString(), is("(kwatl)"));
    assertThat(n.children.size(), is(3L));
    assertThat(n.children.nth(0).symbol, is("kw"));
    assertThat(n.children.nth(2).symbol, is("tl"));
  }

  @Test
  public void whitespaceIsIgnored() {
    assertThat(PatternParser.parse("[ p t ] a", SMALL).toString(), is("([p t]a)"));
  }

  @Test
  public void wildcard() {
    assertThat(PatternParser.parse(".", SMALL).kind, is(Node.Kind.WILDCARD));
  }

  @Test
  public void emptyGroupIsEmptyConcatenation() {
    Node n = PatternParser.parse("()", SMALL);

    assertThat(n.kind, is(Node.Kind.CONCAT));
    assertThat(n.children.size(), is(0L));
  }

  @Test
  public void unbalancedGrouping() {
    assertThat(failure("(pa", SMALL).getMessage(), containsString("unmatched '('"));
    assertThat(failure("pa)", SMALL).getMessage(), containsString("unmatched ')'"));
    assertThat(failure("[pa", SMALL).getMessage(), containsString("unmatched '['"));
    assertThat(failure("pa]", SMALL).getMessage(), containsString("unmatched ']'"));
    assertThat(failure("[p)", SMALL).getMessage(), containsString("unmatched ')'"));
    assertThat(failure("(p]", SMALL).getMessage(), containsString("unmatched '('"));
  }

  @Test
  public void danglingQuantifiers() {
    for (String pattern : new String[]{"*", "?a", "+", "(*p)", "[+p]"}) {
      assertThat(pattern, failure(pattern, SMALL).getMessage(), containsString("nothing to apply to"));
    }
  }

  @Test
  public void errorsReportTheirPosition() {
    PatternException e = failure("pa(t", SMALL);

    assertThat(e.position(), is(2));
    assertThat(e.pattern(), is("pa(t"));
  }

  @Test
  public void emptyUnion() {
    assertThat(failure("[]", SMALL).getMessage(), containsString("empty union"));
  }

  @Test
  public void unknownClass() {
    assertThat(failure("CQ", SMALL).getMessage(), containsString("unknown class or symbol 'Q'"));
    assertThat(failure("pab", NAHUATL).getMessage(), containsString("unknown class or symbol 'b'"));
  }

  @Test
  public void wildcardNeedsAnAlphabet() {
    assertThat(failure(".*", Alphabet.empty()).getMessage(), containsString("needs an alphabet"));
  }

  @Test
  public void errorPositionsSkipWhitespace() {
    assertThat(failure("p ( *t)", SMALL).position(), is(4));
    assertThat(failure("  *", SMALL).position(), is(2));
    assertThat(failure("p [ ]", SMALL).position(), is(2));
  }
}
