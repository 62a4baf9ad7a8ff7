package io.calcshell.shell.cli;

import io.calcshell.core.expr.Constants;
import io.calcshell.core.expr.FunctionTable;
import java.util.List;
import java.util.Locale;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * Completes function names, constants and, at the start of a line, REPL commands.
 *
 * <p>Expressions are often typed without spaces ({@code 2+sq}), so only the trailing run of
 * letters in the current word is matched and the rest of the word is kept as a prefix.
 */
public final class ShellCompleter implements Completer {

  static final List<String> SHELL_COMMANDS = List.of("help", "exit", "quit");

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String word = line.word().substring(0, Math.min(line.wordCursor(), line.word().length()));
    int split = word.length();
    while (split > 0 && Character.isLetter(word.charAt(split - 1))) {
      split--;
    }
    String head = word.substring(0, split);
    String fragment = word.substring(split).toLowerCase(Locale.ROOT);

    if (line.wordIndex() == 0 && head.isEmpty()) {
      for (String cmd : CommandDispatcher.COMMANDS) {
        addIfMatches(candidates, cmd, fragment, cmd, "commands", null, true);
      }
      for (String cmd : SHELL_COMMANDS) {
        addIfMatches(candidates, cmd, fragment, cmd, "commands", null, true);
      }
    }
    for (FunctionTable.FunctionDef def : FunctionTable.all().values()) {
      addIfMatches(
          candidates, def.name(), fragment, head + def.name() + "(", "functions",
          def.description(), false);
    }
    for (String c : Constants.names()) {
      addIfMatches(candidates, c, fragment, head + c, "constants", null, true);
    }
  }

  private static void addIfMatches(
      List<Candidate> candidates,
      String name,
      String fragment,
      String value,
      String group,
      String description,
      boolean complete) {
    if (name.startsWith(fragment)) {
      candidates.add(new Candidate(value, name, group, description, null, null, complete));
    }
  }
}
