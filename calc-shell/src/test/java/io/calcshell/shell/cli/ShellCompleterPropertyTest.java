package io.calcshell.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.jqwik.api.*;
import org.jline.reader.Candidate;
import org.jline.reader.ParsedLine;
import org.jline.reader.impl.DefaultParser;

/** Property-based checks that completion never rewrites what the user already typed. */
@PropertyDefaults(tries = 300)
class ShellCompleterPropertyTest {

  private final ShellCompleter completer = new ShellCompleter();

  @Property
  void candidatesExtendTypedWord(@ForAll("words") String word) {
    for (Candidate c : complete(word)) {
      assertTrue(
          c.value().toLowerCase(Locale.ROOT).startsWith(word.toLowerCase(Locale.ROOT)),
          () -> c.value() + " does not extend " + word);
    }
  }

  @Property
  void expressionPrefixesNeverOfferCommands(
      @ForAll("heads") String head, @ForAll("letters") String fragment) {
    for (Candidate c : complete(head + fragment)) {
      assertNotEquals("commands", c.group(), c.value());
    }
  }

  private List<Candidate> complete(String line) {
    ParsedLine parsed = new DefaultParser().parse(line, line.length());
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(null, parsed, candidates);
    return candidates;
  }

  @Provide
  Arbitrary<String> words() {
    Arbitrary<String> optionalHead = Arbitraries.oneOf(Arbitraries.just(""), heads());
    return Combinators.combine(optionalHead, letters()).as((h, l) -> h + l);
  }

  @Provide
  Arbitrary<String> heads() {
    return Arbitraries.strings()
        .withCharRange('0', '9')
        .withChars('+', '*', '/', '^', '(', '.')
        .ofMinLength(1)
        .ofMaxLength(6);
  }

  @Provide
  Arbitrary<String> letters() {
    return Arbitraries.strings().withCharRange('a', 'z').withCharRange('A', 'Z').ofMaxLength(4);
  }
}
