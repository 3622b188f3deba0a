package com.flamingo.ai.timelineqa.service.structured;

import com.flamingo.ai.timelineqa.exception.QueryGenerationException;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException.Reason;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks generated SQL before it reaches the store. Accepted queries are a single {@code SELECT}
 * over exactly one registered view in which every identifier is a column of that view, an alias,
 * an SQL keyword or an allowed function. Everything else is rejected, including comments,
 * parameters, joins, subqueries, set operations and statements that write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryValidator {

  private static final Set<String> FORBIDDEN =
      Set.of(
          "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "CREATE", "REPLACE", "MERGE", "TRUNCATE",
          "GRANT", "REVOKE", "ATTACH", "DETACH", "PRAGMA", "VACUUM", "REINDEX", "ANALYZE", "EXEC",
          "EXECUTE", "CALL", "UNION", "INTERSECT", "EXCEPT", "JOIN", "INTO", "WITH", "VALUES",
          "LOAD_EXTENSION", "RECURSIVE", "OVER", "WINDOW");

  private static final Set<String> KEYWORDS =
      Set.of(
          "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "AS", "GROUP", "BY", "ORDER", "HAVING",
          "LIMIT", "OFFSET", "ASC", "DESC", "DISTINCT", "BETWEEN", "IN", "IS", "NULL", "LIKE",
          "GLOB", "CASE", "WHEN", "THEN", "ELSE", "END", "TRUE", "FALSE", "COLLATE", "NOCASE",
          "ESCAPE", "ALL", "INTEGER", "REAL", "TEXT", "NUMERIC");

  private static final Set<String> FUNCTIONS =
      Set.of(
          "COUNT", "SUM", "AVG", "MIN", "MAX", "TOTAL", "LOWER", "UPPER", "COALESCE", "IFNULL",
          "NULLIF", "ROUND", "ABS", "LENGTH", "TRIM", "SUBSTR", "INSTR", "STRFTIME", "DATE",
          "DATETIME", "JULIANDAY", "CAST");

  private final StructuredViewRegistry viewRegistry;

  /**
   * Validates a generated query.
   *
   * @param sql generated SQL
   * @param declaredView view the generator said it targets, may be null
   * @return the query with any trailing semicolon removed, bound to its view
   * @throws QueryGenerationException with reason {@link Reason#VALIDATION_REJECTED}
   */
  public ValidatedQuery validate(String sql, String declaredView) {
    if (sql == null || sql.isBlank()) {
      throw reject("empty query");
    }
    String statement = sql.strip();
    if (statement.endsWith(";")) {
      statement = statement.substring(0, statement.length() - 1).stripTrailing();
    }
    List<Token> tokens = tokenize(statement);

    if (tokens.isEmpty() || !tokens.get(0).isWord("SELECT")) {
      throw reject("query must start with SELECT");
    }
    int selects = 0;
    int fromIndex = -1;
    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.type() != TokenType.WORD) {
        continue;
      }
      String upper = token.upper();
      if (FORBIDDEN.contains(upper)) {
        throw reject("forbidden keyword " + upper);
      }
      if (upper.equals("SELECT")) {
        selects++;
      }
      if (upper.equals("FROM")) {
        if (fromIndex >= 0) {
          throw reject("more than one FROM clause");
        }
        fromIndex = i;
      }
    }
    if (selects != 1) {
      throw reject("subqueries are not allowed");
    }
    if (fromIndex < 0 || fromIndex + 1 >= tokens.size()) {
      throw reject("missing FROM clause");
    }

    Token viewToken = tokens.get(fromIndex + 1);
    if (viewToken.type() != TokenType.WORD && viewToken.type() != TokenType.QUOTED_IDENTIFIER) {
      throw reject("FROM must name a view");
    }
    StructuredView view =
        viewRegistry
            .find(viewToken.text())
            .orElseThrow(() -> reject("unknown view " + viewToken.text()));
    if (declaredView != null
        && !declaredView.isBlank()
        && !declaredView.strip().equalsIgnoreCase(view.name())) {
      log.debug("Generator declared view {} but query reads {}", declaredView, view.name());
    }

    Set<String> aliases = new HashSet<>();
    int afterView = fromIndex + 2;
    if (afterView < tokens.size() && tokens.get(afterView).isWord("AS")) {
      afterView++;
    }
    if (afterView < tokens.size()
        && tokens.get(afterView).type() == TokenType.WORD
        && !KEYWORDS.contains(tokens.get(afterView).upper())) {
      aliases.add(tokens.get(afterView).upper());
      afterView++;
    }
    if (afterView < tokens.size() && tokens.get(afterView).isSymbol(",")) {
      throw reject("only one view may be queried");
    }
    for (int i = 1; i < tokens.size(); i++) {
      if (tokens.get(i - 1).isWord("AS") && tokens.get(i).isIdentifier()) {
        aliases.add(tokens.get(i).upper());
      }
    }

    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (!token.isIdentifier() || i == fromIndex + 1) {
        continue;
      }
      boolean qualifier = i + 1 < tokens.size() && tokens.get(i + 1).isSymbol(".");
      boolean qualified = i > 0 && tokens.get(i - 1).isSymbol(".");
      boolean call = i + 1 < tokens.size() && tokens.get(i + 1).isSymbol("(");
      String upper = token.upper();

      if (qualifier) {
        if (!upper.equalsIgnoreCase(view.name()) && !aliases.contains(upper)) {
          throw reject("unknown qualifier " + token.text());
        }
      } else if (qualified) {
        if (!view.hasColumn(token.text())) {
          throw reject("unknown column " + token.text() + " in view " + view.name());
        }
      } else if (call && token.type() == TokenType.WORD) {
        if (!FUNCTIONS.contains(upper) && !KEYWORDS.contains(upper)) {
          throw reject("function " + upper + " is not allowed");
        }
      } else if (!view.hasColumn(token.text())
          && !aliases.contains(upper)
          && !(token.type() == TokenType.WORD && KEYWORDS.contains(upper))) {
        throw reject("unknown identifier " + token.text());
      }
    }

    log.debug("Validated query over view {}", view.name());
    return new ValidatedQuery(view, statement);
  }

  private static List<Token> tokenize(String sql) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    int length = sql.length();
    while (i < length) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if ((c == '-' && i + 1 < length && sql.charAt(i + 1) == '-')
          || (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*')) {
        throw reject("comments are not allowed");
      } else if (c == '\'') {
        int end = i + 1;
        StringBuilder literal = new StringBuilder();
        while (true) {
          if (end >= length) {
            throw reject("unterminated string literal");
          }
          char next = sql.charAt(end);
          if (next == '\'') {
            if (end + 1 < length && sql.charAt(end + 1) == '\'') {
              literal.append('\'');
              end += 2;
              continue;
            }
            break;
          }
          literal.append(next);
          end++;
        }
        tokens.add(new Token(TokenType.STRING, literal.toString()));
        i = end + 1;
      } else if (c == '"' || c == '`') {
        int end = sql.indexOf(c, i + 1);
        if (end < 0) {
          throw reject("unterminated quoted identifier");
        }
        tokens.add(new Token(TokenType.QUOTED_IDENTIFIER, sql.substring(i + 1, end)));
        i = end + 1;
      } else if (Character.isLetter(c) || c == '_') {
        int end = i + 1;
        while (end < length
            && (Character.isLetterOrDigit(sql.charAt(end)) || sql.charAt(end) == '_')) {
          end++;
        }
        tokens.add(new Token(TokenType.WORD, sql.substring(i, end)));
        i = end;
      } else if (Character.isDigit(c)) {
        int end = i + 1;
        while (end < length && (Character.isDigit(sql.charAt(end)) || sql.charAt(end) == '.')) {
          end++;
        }
        if (end < length && (Character.isLetter(sql.charAt(end)) || sql.charAt(end) == '_')) {
          throw reject("malformed number");
        }
        tokens.add(new Token(TokenType.NUMBER, sql.substring(i, end)));
        i = end;
      } else if ("<>!=|".indexOf(c) >= 0) {
        int end = i + 1;
        while (end < length && "<>!=|".indexOf(sql.charAt(end)) >= 0) {
          end++;
        }
        String operator = sql.substring(i, end);
        if (!Set.of("=", "==", "<", ">", "<=", ">=", "!=", "<>", "||").contains(operator)) {
          throw reject("unsupported operator " + operator);
        }
        tokens.add(new Token(TokenType.SYMBOL, operator));
        i = end;
      } else if ("(),.*+-/%".indexOf(c) >= 0) {
        tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c)));
        i++;
      } else if (c == ';') {
        throw reject("only one statement is allowed");
      } else if ("?:@$".indexOf(c) >= 0) {
        throw reject("parameters are not allowed");
      } else {
        throw reject("unexpected character '" + c + "'");
      }
    }
    return tokens;
  }

  private static QueryGenerationException reject(String reason) {
    return new QueryGenerationException(Reason.VALIDATION_REJECTED, "Query rejected: " + reason);
  }

  private enum TokenType {
    WORD,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    SYMBOL
  }

  private record Token(TokenType type, String text) {

    String upper() {
      return text.toUpperCase(Locale.ROOT);
    }

    boolean isWord(String word) {
      return type == TokenType.WORD && text.equalsIgnoreCase(word);
    }

    boolean isSymbol(String symbol) {
      return type == TokenType.SYMBOL && text.equals(symbol);
    }

    boolean isIdentifier() {
      return type == TokenType.WORD || type == TokenType.QUOTED_IDENTIFIER;
    }
  }
}
