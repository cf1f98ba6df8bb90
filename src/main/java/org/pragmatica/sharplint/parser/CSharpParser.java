package org.pragmatica.sharplint.parser;

import org.pragmatica.sharplint.error.ParseError;
import org.pragmatica.sharplint.tree.SourceLocation;
import org.pragmatica.sharplint.tree.SyntaxElement;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxToken;
import org.pragmatica.sharplint.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.pragmatica.sharplint.tree.SyntaxKind.*;

/**
 * Recursive-descent parser for a practical subset of C#.
 *
 * <p>The parser builds a lossless tree: every lexed token, with its trivia, becomes a leaf, so the full text of
 * the resulting root equals the input. Declaration modifiers are kept as flat token children placed after any
 * attribute lists. Parsing stops at the first error.
 */
public final class CSharpParser {
    private static final Logger log = LoggerFactory.getLogger(CSharpParser.class);

    private static final Set<SyntaxKind> ASSIGNMENT_OPERATORS = EnumSet.of(EQUALS_TOKEN,
                                                                           PLUS_EQUALS_TOKEN,
                                                                           MINUS_EQUALS_TOKEN,
                                                                           ASTERISK_EQUALS_TOKEN,
                                                                           SLASH_EQUALS_TOKEN,
                                                                           PERCENT_EQUALS_TOKEN,
                                                                           AMPERSAND_EQUALS_TOKEN,
                                                                           BAR_EQUALS_TOKEN,
                                                                           CARET_EQUALS_TOKEN,
                                                                           LESS_THAN_LESS_THAN_EQUALS_TOKEN,
                                                                           QUESTION_QUESTION_EQUALS_TOKEN);

    private static final Set<SyntaxKind> PREFIX_OPERATORS = EnumSet.of(PLUS_TOKEN,
                                                                       MINUS_TOKEN,
                                                                       EXCLAMATION_TOKEN,
                                                                       TILDE_TOKEN,
                                                                       PLUS_PLUS_TOKEN,
                                                                       MINUS_MINUS_TOKEN,
                                                                       AMPERSAND_TOKEN,
                                                                       ASTERISK_TOKEN,
                                                                       CARET_TOKEN);

    private static final Set<SyntaxKind> LITERALS = EnumSet.of(NUMERIC_LITERAL_TOKEN,
                                                               STRING_LITERAL_TOKEN,
                                                               CHARACTER_LITERAL_TOKEN,
                                                               TRUE_KEYWORD,
                                                               FALSE_KEYWORD,
                                                               NULL_KEYWORD);

    private static final Set<SyntaxKind> OPERAND_STARTS = EnumSet.of(IDENTIFIER_TOKEN,
                                                                     NUMERIC_LITERAL_TOKEN,
                                                                     STRING_LITERAL_TOKEN,
                                                                     CHARACTER_LITERAL_TOKEN,
                                                                     TRUE_KEYWORD,
                                                                     FALSE_KEYWORD,
                                                                     NULL_KEYWORD,
                                                                     OPEN_PAREN_TOKEN,
                                                                     THIS_KEYWORD,
                                                                     BASE_KEYWORD,
                                                                     NEW_KEYWORD,
                                                                     TYPEOF_KEYWORD,
                                                                     DEFAULT_KEYWORD,
                                                                     SIZEOF_KEYWORD,
                                                                     CHECKED_KEYWORD,
                                                                     UNCHECKED_KEYWORD,
                                                                     DELEGATE_KEYWORD,
                                                                     EXCLAMATION_TOKEN,
                                                                     TILDE_TOKEN);

    private static final Set<SyntaxKind> TYPE_KEYWORDS = EnumSet.of(CLASS_KEYWORD,
                                                                    STRUCT_KEYWORD,
                                                                    INTERFACE_KEYWORD,
                                                                    ENUM_KEYWORD,
                                                                    DELEGATE_KEYWORD,
                                                                    EVENT_KEYWORD);

    private static final Set<String> ACCESSOR_KEYWORDS = Set.of("get", "set", "init", "add", "remove");

    /**
     * Binary operator levels, lowest precedence first.
     */
    private static final List<Set<SyntaxKind>> BINARY_LEVELS = List.of(EnumSet.of(BAR_BAR_TOKEN),
                                                                       EnumSet.of(AMPERSAND_AMPERSAND_TOKEN),
                                                                       EnumSet.of(BAR_TOKEN),
                                                                       EnumSet.of(CARET_TOKEN),
                                                                       EnumSet.of(AMPERSAND_TOKEN),
                                                                       EnumSet.of(EQUALS_EQUALS_TOKEN,
                                                                                  EXCLAMATION_EQUALS_TOKEN),
                                                                       EnumSet.of(LESS_THAN_TOKEN,
                                                                                  GREATER_THAN_TOKEN,
                                                                                  LESS_THAN_EQUALS_TOKEN,
                                                                                  GREATER_THAN_EQUALS_TOKEN,
                                                                                  IS_KEYWORD,
                                                                                  AS_KEYWORD),
                                                                       EnumSet.of(LESS_THAN_LESS_THAN_TOKEN,
                                                                                  GREATER_THAN_TOKEN),
                                                                       EnumSet.of(PLUS_TOKEN, MINUS_TOKEN),
                                                                       EnumSet.of(ASTERISK_TOKEN,
                                                                                  SLASH_TOKEN,
                                                                                  PERCENT_TOKEN));
    private static final int RELATIONAL_LEVEL = 6;
    private static final int SHIFT_LEVEL = 7;

    private final List<LexedToken> tokens;
    private int pos;

    private CSharpParser(List<LexedToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse C# source text into a syntax tree.
     */
    public static ParseResult parse(String source) {
        List<LexedToken> tokens;
        try{
            tokens = CSharpLexer.tokenize(source);
        } catch (IllegalArgumentException e) {
            return new ParseResult.Failure(new ParseError.LexicalError(SourceLocation.START, e.getMessage()));
        }
        // Check for lexer errors
        for (var token : tokens) {
            if (token.problem()
                     .isPresent()) {
                return new ParseResult.Failure(new ParseError.LexicalError(token.span()
                                                                                .start(),
                                                                           token.problem()
                                                                                .get()));
            }
        }
        try{
            var root = new CSharpParser(tokens).parseCompilationUnit();
            return new ParseResult.Success(SyntaxTree.of(root));
        } catch (ParseFailure failure) {
            log.debug("Parse failed: {}", failure.error.message());
            return new ParseResult.Failure(failure.error);
        }
    }

    /**
     * Unwinds the descent on the first syntax error.
     */
    private static final class ParseFailure extends RuntimeException {
        private final ParseError error;

        private ParseFailure(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }

    // === Declarations ===

    private SyntaxNode parseCompilationUnit() {
        var children = new ArrayList<SyntaxElement>();
        parseNamespaceBody(children, true);
        children.add(expect(END_OF_FILE_TOKEN, "declaration"));
        return node(COMPILATION_UNIT, children);
    }

    private void parseNamespaceBody(List<SyntaxElement> children, boolean topLevel) {
        while (!at(END_OF_FILE_TOKEN) && (topLevel || !at(CLOSE_BRACE_TOKEN))) {
            if (at(USING_KEYWORD)) {
                children.add(parseUsingDirective());
            }else if (at(NAMESPACE_KEYWORD)) {
                children.add(parseNamespace());
            }else {
                children.add(parseMemberDeclaration());
            }
        }
    }

    private SyntaxNode parseUsingDirective() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        if (at(STATIC_KEYWORD)) {
            children.add(take());
        }
        if (at(IDENTIFIER_TOKEN) && kind(1) == EQUALS_TOKEN) {
            children.add(take());
            children.add(take());
        }
        children.add(parseType(false));
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(USING_DIRECTIVE, children);
    }

    private SyntaxNode parseNamespace() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        children.add(parseQualifiedName());
        if (at(SEMICOLON_TOKEN)) {
            // file-scoped namespace owns the rest of the file
            children.add(take());
            parseNamespaceBody(children, true);
            return node(NAMESPACE_DECLARATION, children);
        }
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        parseNamespaceBody(children, false);
        children.add(expect(CLOSE_BRACE_TOKEN, "'}'"));
        if (at(SEMICOLON_TOKEN)) {
            children.add(take());
        }
        return node(NAMESPACE_DECLARATION, children);
    }

    private SyntaxNode parseQualifiedName() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(IDENTIFIER_TOKEN, "name"));
        while (at(DOT_TOKEN) && kind(1) == IDENTIFIER_TOKEN) {
            children.add(take());
            children.add(take());
        }
        return node(NAME, children);
    }

    private SyntaxNode parseMemberDeclaration() {
        var children = new ArrayList<SyntaxElement>();
        parseAttributeLists(children);
        parseModifiers(children);
        return switch (kind(0)) {
            case CLASS_KEYWORD -> parseTypeDeclaration(children, CLASS_DECLARATION);
            case STRUCT_KEYWORD -> parseTypeDeclaration(children, STRUCT_DECLARATION);
            case INTERFACE_KEYWORD -> parseTypeDeclaration(children, INTERFACE_DECLARATION);
            case ENUM_KEYWORD -> parseEnumDeclaration(children);
            case DELEGATE_KEYWORD -> parseDelegateDeclaration(children);
            case EVENT_KEYWORD -> parseEventDeclaration(children);
            case TILDE_TOKEN -> parseDestructor(children);
            case IMPLICIT_KEYWORD, EXPLICIT_KEYWORD -> parseConversionOperator(children);
            default -> parseTypedMember(children);
        };
    }

    private void parseAttributeLists(List<SyntaxElement> children) {
        while (at(OPEN_BRACKET_TOKEN)) {
            var list = new ArrayList<SyntaxElement>();
            int depth = 0;
            do {
                if (at(END_OF_FILE_TOKEN)) {
                    throw failure("']'");
                }
                if (at(OPEN_BRACKET_TOKEN)) {
                    depth++ ;
                }else if (at(CLOSE_BRACKET_TOKEN)) {
                    depth-- ;
                }
                list.add(take());
            } while (depth > 0);
            children.add(node(ATTRIBUTE_LIST, list));
        }
    }

    private void parseModifiers(List<SyntaxElement> children) {
        while (true) {
            if (kind(0).isModifier() && kind(0) != PARTIAL_KEYWORD && kind(0) != ASYNC_KEYWORD) {
                children.add(take());
            }else if (atContextual("partial") && isContextualModifier()) {
                children.add(takeAs(PARTIAL_KEYWORD));
            }else if (atContextual("async") && isContextualModifier()) {
                children.add(takeAs(ASYNC_KEYWORD));
            }else {
                return;
            }
        }
    }

    private boolean isContextualModifier() {
        var next = kind(1);
        if (next.isModifier() || next.isPredefinedType() || TYPE_KEYWORDS.contains(next)) {
            return true;
        }
        if (next != IDENTIFIER_TOKEN) {
            return false;
        }
        var after = kind(2);
        return after == IDENTIFIER_TOKEN || after == LESS_THAN_TOKEN || after == DOT_TOKEN
               || after == OPEN_BRACKET_TOKEN || after == QUESTION_TOKEN;
    }

    private SyntaxNode parseTypeDeclaration(List<SyntaxElement> children, SyntaxKind declarationKind) {
        children.add(take());
        children.add(expect(IDENTIFIER_TOKEN, "type name"));
        parseTypeParameterList(children);
        parseBaseList(children);
        parseConstraintClauses(children);
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        while (!at(CLOSE_BRACE_TOKEN)) {
            if (at(END_OF_FILE_TOKEN)) {
                throw failure("'}'");
            }
            children.add(parseMemberDeclaration());
        }
        children.add(take());
        if (at(SEMICOLON_TOKEN)) {
            children.add(take());
        }
        return node(declarationKind, children);
    }

    private SyntaxNode parseEnumDeclaration(List<SyntaxElement> children) {
        children.add(take());
        children.add(expect(IDENTIFIER_TOKEN, "enum name"));
        parseBaseList(children);
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        while (!at(CLOSE_BRACE_TOKEN)) {
            var member = new ArrayList<SyntaxElement>();
            parseAttributeLists(member);
            member.add(expect(IDENTIFIER_TOKEN, "enum member"));
            if (at(EQUALS_TOKEN)) {
                member.add(parseEqualsValueClause());
            }
            children.add(node(ENUM_MEMBER_DECLARATION, member));
            if (!at(COMMA_TOKEN)) {
                break;
            }
            children.add(take());
        }
        children.add(expect(CLOSE_BRACE_TOKEN, "'}'"));
        if (at(SEMICOLON_TOKEN)) {
            children.add(take());
        }
        return node(ENUM_DECLARATION, children);
    }

    private SyntaxNode parseDelegateDeclaration(List<SyntaxElement> children) {
        children.add(take());
        children.add(parseType(true));
        children.add(expect(IDENTIFIER_TOKEN, "delegate name"));
        parseTypeParameterList(children);
        children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        parseConstraintClauses(children);
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(DELEGATE_DECLARATION, children);
    }

    private SyntaxNode parseEventDeclaration(List<SyntaxElement> children) {
        children.add(take());
        var type = parseType(true);
        int nameEnd = qualifiedNameEnd(0);
        if (nameEnd > 0 && kind(nameEnd) == OPEN_BRACE_TOKEN) {
            children.add(type);
            takeQualifiedName(children);
            children.add(parseAccessorList());
            return node(EVENT_DECLARATION, children);
        }
        children.add(parseVariableDeclaration(type));
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(EVENT_FIELD_DECLARATION, children);
    }

    private SyntaxNode parseDestructor(List<SyntaxElement> children) {
        children.add(take());
        children.add(expect(IDENTIFIER_TOKEN, "type name"));
        children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        parseBody(children);
        return node(DESTRUCTOR_DECLARATION, children);
    }

    private SyntaxNode parseConversionOperator(List<SyntaxElement> children) {
        children.add(take());
        children.add(expect(OPERATOR_KEYWORD, "'operator'"));
        children.add(parseType(true));
        children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        parseBody(children);
        return node(CONVERSION_OPERATOR_DECLARATION, children);
    }

    /**
     * Members that start with a type (or a constructor name): fields, properties, indexers, methods, operators.
     */
    private SyntaxNode parseTypedMember(List<SyntaxElement> children) {
        if (at(IDENTIFIER_TOKEN) && kind(1) == OPEN_PAREN_TOKEN) {
            return parseConstructor(children);
        }
        var type = parseType(true);
        if (at(OPERATOR_KEYWORD)) {
            children.add(type);
            return parseOperator(children);
        }
        if (at(THIS_KEYWORD)) {
            children.add(type);
            return parseIndexer(children);
        }
        int nameEnd = qualifiedNameEnd(0);
        if (nameEnd < 0) {
            throw failure("member name");
        }
        var next = kind(nameEnd);
        if (next == OPEN_PAREN_TOKEN || next == LESS_THAN_TOKEN) {
            children.add(type);
            takeQualifiedName(children);
            return parseMethod(children);
        }
        if (next == OPEN_BRACE_TOKEN || next == EQUALS_GREATER_THAN_TOKEN) {
            children.add(type);
            takeQualifiedName(children);
            return parseProperty(children);
        }
        children.add(parseVariableDeclaration(type));
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(FIELD_DECLARATION, children);
    }

    private SyntaxNode parseConstructor(List<SyntaxElement> children) {
        children.add(take());
        children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        if (at(COLON_TOKEN)) {
            var initializer = new ArrayList<SyntaxElement>();
            initializer.add(take());
            if (!at(BASE_KEYWORD) && !at(THIS_KEYWORD)) {
                throw failure("'base' or 'this'");
            }
            initializer.add(take());
            initializer.add(parseArgumentList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, ARGUMENT_LIST));
            children.add(node(CONSTRUCTOR_INITIALIZER, initializer));
        }
        parseBody(children);
        return node(CONSTRUCTOR_DECLARATION, children);
    }

    private SyntaxNode parseOperator(List<SyntaxElement> children) {
        children.add(take());
        if (at(GREATER_THAN_TOKEN) && kind(1) == GREATER_THAN_TOKEN && adjacent(0)) {
            children.add(take());
            children.add(take());
        }else if (kind(0).isPunctuation() || at(TRUE_KEYWORD) || at(FALSE_KEYWORD)) {
            children.add(take());
        }else {
            throw failure("overloadable operator");
        }
        children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        parseBody(children);
        return node(OPERATOR_DECLARATION, children);
    }

    private SyntaxNode parseIndexer(List<SyntaxElement> children) {
        children.add(take());
        children.add(parseParameterList(OPEN_BRACKET_TOKEN, CLOSE_BRACKET_TOKEN, BRACKETED_PARAMETER_LIST));
        if (at(EQUALS_GREATER_THAN_TOKEN)) {
            children.add(parseArrowExpressionClause());
            children.add(expect(SEMICOLON_TOKEN, "';'"));
        }else {
            children.add(parseAccessorList());
        }
        return node(INDEXER_DECLARATION, children);
    }

    private SyntaxNode parseMethod(List<SyntaxElement> children) {
        parseTypeParameterList(children);
        children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        parseConstraintClauses(children);
        parseBody(children);
        return node(METHOD_DECLARATION, children);
    }

    private SyntaxNode parseProperty(List<SyntaxElement> children) {
        if (at(EQUALS_GREATER_THAN_TOKEN)) {
            children.add(parseArrowExpressionClause());
            children.add(expect(SEMICOLON_TOKEN, "';'"));
            return node(PROPERTY_DECLARATION, children);
        }
        children.add(parseAccessorList());
        if (at(EQUALS_TOKEN)) {
            children.add(parseEqualsValueClause());
            children.add(expect(SEMICOLON_TOKEN, "';'"));
        }
        return node(PROPERTY_DECLARATION, children);
    }

    private SyntaxNode parseAccessorList() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        while (!at(CLOSE_BRACE_TOKEN)) {
            var accessor = new ArrayList<SyntaxElement>();
            parseAttributeLists(accessor);
            while (kind(0).isAccessModifier()) {
                accessor.add(take());
            }
            if (!at(IDENTIFIER_TOKEN) || !ACCESSOR_KEYWORDS.contains(current().text())) {
                throw failure("accessor");
            }
            var accessorKind = SyntaxKind.contextualKeyword(current().text())
                                         .orElseThrow();
            accessor.add(takeAs(accessorKind));
            parseBody(accessor);
            children.add(node(ACCESSOR_DECLARATION, accessor));
        }
        children.add(take());
        return node(ACCESSOR_LIST, children);
    }

    /**
     * Member or accessor body: a block, an expression body, or a bare semicolon.
     */
    private void parseBody(List<SyntaxElement> children) {
        if (at(OPEN_BRACE_TOKEN)) {
            children.add(parseBlock());
        }else if (at(EQUALS_GREATER_THAN_TOKEN)) {
            children.add(parseArrowExpressionClause());
            children.add(expect(SEMICOLON_TOKEN, "';'"));
        }else {
            children.add(expect(SEMICOLON_TOKEN, "body or ';'"));
        }
    }

    private SyntaxNode parseArrowExpressionClause() {
        var arrow = take();
        return node(ARROW_EXPRESSION_CLAUSE, List.of(arrow, parseExpression()));
    }

    private SyntaxNode parseEqualsValueClause() {
        var equals = take();
        return node(EQUALS_VALUE_CLAUSE, List.of(equals, parseVariableInitializer()));
    }

    private SyntaxNode parseVariableInitializer() {
        return at(OPEN_BRACE_TOKEN)
               ? parseInitializer()
               : parseExpression();
    }

    private SyntaxNode parseVariableDeclaration(SyntaxNode type) {
        var children = new ArrayList<SyntaxElement>();
        children.add(type);
        children.add(parseVariableDeclarator());
        while (at(COMMA_TOKEN)) {
            children.add(take());
            children.add(parseVariableDeclarator());
        }
        return node(VARIABLE_DECLARATION, children);
    }

    private SyntaxNode parseVariableDeclarator() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(IDENTIFIER_TOKEN, "variable name"));
        if (at(OPEN_BRACKET_TOKEN)) {
            children.add(parseArgumentList(OPEN_BRACKET_TOKEN, CLOSE_BRACKET_TOKEN, BRACKETED_ARGUMENT_LIST));
        }
        if (at(EQUALS_TOKEN)) {
            children.add(parseEqualsValueClause());
        }
        return node(VARIABLE_DECLARATOR, children);
    }

    private void parseTypeParameterList(List<SyntaxElement> children) {
        if (!at(LESS_THAN_TOKEN)) {
            return;
        }
        var list = new ArrayList<SyntaxElement>();
        list.add(take());
        while (true) {
            parseAttributeLists(list);
            if (at(IN_KEYWORD) || at(OUT_KEYWORD)) {
                list.add(take());
            }
            list.add(expect(IDENTIFIER_TOKEN, "type parameter"));
            if (!at(COMMA_TOKEN)) {
                break;
            }
            list.add(take());
        }
        list.add(expect(GREATER_THAN_TOKEN, "'>'"));
        children.add(node(TYPE_PARAMETER_LIST, list));
    }

    private void parseBaseList(List<SyntaxElement> children) {
        if (!at(COLON_TOKEN)) {
            return;
        }
        var list = new ArrayList<SyntaxElement>();
        list.add(take());
        list.add(parseType(false));
        while (at(COMMA_TOKEN)) {
            list.add(take());
            list.add(parseType(false));
        }
        children.add(node(BASE_LIST, list));
    }

    private void parseConstraintClauses(List<SyntaxElement> children) {
        while (atContextual("where") && kind(1) == IDENTIFIER_TOKEN && kind(2) == COLON_TOKEN) {
            var clause = new ArrayList<SyntaxElement>();
            clause.add(takeAs(WHERE_KEYWORD));
            clause.add(take());
            clause.add(take());
            while (true) {
                if (at(CLASS_KEYWORD) || at(STRUCT_KEYWORD)) {
                    clause.add(take());
                    if (at(QUESTION_TOKEN)) {
                        clause.add(take());
                    }
                }else if (at(NEW_KEYWORD)) {
                    clause.add(take());
                    clause.add(expect(OPEN_PAREN_TOKEN, "'('"));
                    clause.add(expect(CLOSE_PAREN_TOKEN, "')'"));
                }else {
                    clause.add(parseType(true));
                }
                if (!at(COMMA_TOKEN)) {
                    break;
                }
                clause.add(take());
            }
            children.add(node(TYPE_PARAMETER_CONSTRAINT_CLAUSE, clause));
        }
    }

    private SyntaxNode parseParameterList(SyntaxKind open, SyntaxKind close, SyntaxKind listKind) {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(open, "'" + open.text() + "'"));
        if (!at(close)) {
            children.add(parseParameter());
            while (at(COMMA_TOKEN)) {
                children.add(take());
                children.add(parseParameter());
            }
        }
        children.add(expect(close, "'" + close.text() + "'"));
        return node(listKind, children);
    }

    private SyntaxNode parseParameter() {
        var children = new ArrayList<SyntaxElement>();
        parseAttributeLists(children);
        while (at(REF_KEYWORD) || at(OUT_KEYWORD) || at(IN_KEYWORD) || at(PARAMS_KEYWORD) || at(THIS_KEYWORD)) {
            children.add(take());
        }
        children.add(parseType(true));
        children.add(expect(IDENTIFIER_TOKEN, "parameter name"));
        if (at(EQUALS_TOKEN)) {
            children.add(parseEqualsValueClause());
        }
        return node(PARAMETER, children);
    }

    private SyntaxNode parseLambdaParameterList() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(OPEN_PAREN_TOKEN, "'('"));
        while (!at(CLOSE_PAREN_TOKEN)) {
            var parameter = new ArrayList<SyntaxElement>();
            while (at(REF_KEYWORD) || at(OUT_KEYWORD) || at(IN_KEYWORD) || at(PARAMS_KEYWORD)) {
                parameter.add(take());
            }
            if (!(at(IDENTIFIER_TOKEN) && (kind(1) == COMMA_TOKEN || kind(1) == CLOSE_PAREN_TOKEN))) {
                parameter.add(parseType(true));
            }
            parameter.add(expect(IDENTIFIER_TOKEN, "parameter name"));
            children.add(node(PARAMETER, parameter));
            if (!at(COMMA_TOKEN)) {
                break;
            }
            children.add(take());
        }
        children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
        return node(PARAMETER_LIST, children);
    }

    // === Types ===

    private SyntaxNode parseType(boolean allowNullable) {
        var children = new ArrayList<SyntaxElement>();
        if (kind(0).isPredefinedType()) {
            children.add(take());
        }else {
            children.add(expect(IDENTIFIER_TOKEN, "type"));
            parseTypeArgumentList(children);
            while (at(DOT_TOKEN) && kind(1) == IDENTIFIER_TOKEN) {
                children.add(take());
                children.add(take());
                parseTypeArgumentList(children);
            }
        }
        while (true) {
            if (allowNullable && at(QUESTION_TOKEN)) {
                children.add(take());
            }else if (at(OPEN_BRACKET_TOKEN) && (kind(1) == CLOSE_BRACKET_TOKEN || kind(1) == COMMA_TOKEN)) {
                children.add(take());
                while (at(COMMA_TOKEN)) {
                    children.add(take());
                }
                children.add(expect(CLOSE_BRACKET_TOKEN, "']'"));
            }else {
                break;
            }
        }
        return node(TYPE, children);
    }

    private void parseTypeArgumentList(List<SyntaxElement> children) {
        if (!at(LESS_THAN_TOKEN)) {
            return;
        }
        var list = new ArrayList<SyntaxElement>();
        list.add(take());
        while (true) {
            // unbound generic names such as Dictionary<,> have no type arguments
            if (!at(COMMA_TOKEN) && !at(GREATER_THAN_TOKEN)) {
                list.add(parseType(true));
            }
            if (!at(COMMA_TOKEN)) {
                break;
            }
            list.add(take());
        }
        list.add(expect(GREATER_THAN_TOKEN, "'>'"));
        children.add(node(TYPE_ARGUMENT_LIST, list));
    }

    /**
     * Speculatively scan a type starting at the absolute token index. Returns the index just past it, or -1.
     */
    private int scanType(int index) {
        int i = index;
        var first = kindAt(i);
        if (first.isPredefinedType()) {
            i++ ;
        }else if (first == IDENTIFIER_TOKEN) {
            i = scanTypeArguments(i + 1);
            while (i > 0 && kindAt(i) == DOT_TOKEN && kindAt(i + 1) == IDENTIFIER_TOKEN) {
                i = scanTypeArguments(i + 2);
            }
            if (i < 0) {
                return -1;
            }
        }else {
            return -1;
        }
        while (true) {
            if (kindAt(i) == QUESTION_TOKEN) {
                i++ ;
            }else if (kindAt(i) == OPEN_BRACKET_TOKEN && (kindAt(i + 1) == CLOSE_BRACKET_TOKEN
                                                          || kindAt(i + 1) == COMMA_TOKEN)) {
                i++ ;
                while (kindAt(i) == COMMA_TOKEN) {
                    i++ ;
                }
                if (kindAt(i) != CLOSE_BRACKET_TOKEN) {
                    return -1;
                }
                i++ ;
            }else {
                return i;
            }
        }
    }

    private int scanTypeArguments(int index) {
        if (kindAt(index) != LESS_THAN_TOKEN) {
            return index;
        }
        int i = index + 1;
        while (true) {
            if (kindAt(i) != COMMA_TOKEN && kindAt(i) != GREATER_THAN_TOKEN) {
                i = scanType(i);
                if (i < 0) {
                    return -1;
                }
            }
            if (kindAt(i) == COMMA_TOKEN) {
                i++ ;
            }else if (kindAt(i) == GREATER_THAN_TOKEN) {
                return i + 1;
            }else {
                return -1;
            }
        }
    }

    /**
     * End (relative offset) of a possibly dotted member name starting at the relative offset, or -1.
     */
    private int qualifiedNameEnd(int ahead) {
        if (kind(ahead) != IDENTIFIER_TOKEN) {
            return -1;
        }
        int i = ahead + 1;
        while (kind(i) == DOT_TOKEN && kind(i + 1) == IDENTIFIER_TOKEN) {
            i += 2;
        }
        return i;
    }

    private void takeQualifiedName(List<SyntaxElement> children) {
        children.add(expect(IDENTIFIER_TOKEN, "name"));
        while (at(DOT_TOKEN) && kind(1) == IDENTIFIER_TOKEN) {
            children.add(take());
            children.add(take());
        }
    }

    // === Statements ===

    private SyntaxNode parseBlock() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        while (!at(CLOSE_BRACE_TOKEN)) {
            if (at(END_OF_FILE_TOKEN)) {
                throw failure("'}'");
            }
            children.add(parseStatement());
        }
        children.add(take());
        return node(BLOCK, children);
    }

    private SyntaxNode parseStatement() {
        return switch (kind(0)) {
            case OPEN_BRACE_TOKEN -> parseBlock();
            case SEMICOLON_TOKEN -> node(EMPTY_STATEMENT, List.of(take()));
            case IF_KEYWORD -> parseIf();
            case WHILE_KEYWORD -> parseWhile();
            case DO_KEYWORD -> parseDo();
            case FOR_KEYWORD -> parseFor();
            case FOREACH_KEYWORD -> parseForeach();
            case RETURN_KEYWORD, THROW_KEYWORD -> parseJump(at(RETURN_KEYWORD)
                                                            ? RETURN_STATEMENT
                                                            : THROW_STATEMENT);
            case BREAK_KEYWORD -> node(BREAK_STATEMENT, List.of(take(), expect(SEMICOLON_TOKEN, "';'")));
            case CONTINUE_KEYWORD -> node(CONTINUE_STATEMENT, List.of(take(), expect(SEMICOLON_TOKEN, "';'")));
            case TRY_KEYWORD -> parseTry();
            case USING_KEYWORD -> parseUsingStatement();
            case LOCK_KEYWORD -> parseLock();
            case SWITCH_KEYWORD -> parseSwitch();
            case CONST_KEYWORD -> parseLocalDeclaration(new ArrayList<>(List.of(take())));
            default -> parseOtherStatement();
        };
    }

    private SyntaxNode parseOtherStatement() {
        if (atContextual("yield") && (kind(1) == RETURN_KEYWORD || kind(1) == BREAK_KEYWORD)) {
            var yield = takeAs(YIELD_KEYWORD);
            if (at(BREAK_KEYWORD)) {
                return node(YIELD_BREAK_STATEMENT, List.of(yield, take(), expect(SEMICOLON_TOKEN, "';'")));
            }
            var children = new ArrayList<SyntaxElement>(List.of(yield, take()));
            children.add(parseExpression());
            children.add(expect(SEMICOLON_TOKEN, "';'"));
            return node(YIELD_RETURN_STATEMENT, children);
        }
        if (isLocalDeclaration()) {
            return parseLocalDeclaration(new ArrayList<>());
        }
        var expression = parseExpression();
        return node(EXPRESSION_STATEMENT, List.of(expression, expect(SEMICOLON_TOKEN, "';'")));
    }

    private boolean isLocalDeclaration() {
        int end = scanType(pos);
        if (end < 0 || kindAt(end) != IDENTIFIER_TOKEN) {
            return false;
        }
        var next = kindAt(end + 1);
        return next == EQUALS_TOKEN || next == SEMICOLON_TOKEN || next == COMMA_TOKEN;
    }

    private SyntaxNode parseLocalDeclaration(List<SyntaxElement> children) {
        children.add(parseVariableDeclaration(parseType(true)));
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(LOCAL_DECLARATION_STATEMENT, children);
    }

    private SyntaxNode parseIf() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        parseParenthesizedCondition(children);
        children.add(parseStatement());
        if (at(ELSE_KEYWORD)) {
            var elseToken = take();
            children.add(node(ELSE_CLAUSE, List.of(elseToken, parseStatement())));
        }
        return node(IF_STATEMENT, children);
    }

    private SyntaxNode parseWhile() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        parseParenthesizedCondition(children);
        children.add(parseStatement());
        return node(WHILE_STATEMENT, children);
    }

    private SyntaxNode parseDo() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        children.add(parseStatement());
        children.add(expect(WHILE_KEYWORD, "'while'"));
        parseParenthesizedCondition(children);
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(DO_STATEMENT, children);
    }

    private SyntaxNode parseFor() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        children.add(expect(OPEN_PAREN_TOKEN, "'('"));
        if (!at(SEMICOLON_TOKEN)) {
            int end = scanType(pos);
            if (end > 0 && kindAt(end) == IDENTIFIER_TOKEN) {
                children.add(parseVariableDeclaration(parseType(true)));
            }else {
                parseExpressionList(children);
            }
        }
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        if (!at(SEMICOLON_TOKEN)) {
            children.add(parseExpression());
        }
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        if (!at(CLOSE_PAREN_TOKEN)) {
            parseExpressionList(children);
        }
        children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
        children.add(parseStatement());
        return node(FOR_STATEMENT, children);
    }

    private void parseExpressionList(List<SyntaxElement> children) {
        children.add(parseExpression());
        while (at(COMMA_TOKEN)) {
            children.add(take());
            children.add(parseExpression());
        }
    }

    private SyntaxNode parseForeach() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        children.add(expect(OPEN_PAREN_TOKEN, "'('"));
        children.add(parseType(true));
        children.add(expect(IDENTIFIER_TOKEN, "iteration variable"));
        children.add(expect(IN_KEYWORD, "'in'"));
        children.add(parseExpression());
        children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
        children.add(parseStatement());
        return node(FOREACH_STATEMENT, children);
    }

    private SyntaxNode parseJump(SyntaxKind statementKind) {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        if (!at(SEMICOLON_TOKEN)) {
            children.add(parseExpression());
        }
        children.add(expect(SEMICOLON_TOKEN, "';'"));
        return node(statementKind, children);
    }

    private SyntaxNode parseTry() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        children.add(parseBlock());
        while (at(CATCH_KEYWORD)) {
            var clause = new ArrayList<SyntaxElement>();
            clause.add(take());
            if (at(OPEN_PAREN_TOKEN)) {
                var declaration = new ArrayList<SyntaxElement>();
                declaration.add(take());
                declaration.add(parseType(false));
                if (at(IDENTIFIER_TOKEN)) {
                    declaration.add(take());
                }
                declaration.add(expect(CLOSE_PAREN_TOKEN, "')'"));
                clause.add(node(CATCH_DECLARATION, declaration));
            }
            if (atContextual("when")) {
                clause.add(take());
                parseParenthesizedCondition(clause);
            }
            clause.add(parseBlock());
            children.add(node(CATCH_CLAUSE, clause));
        }
        if (at(FINALLY_KEYWORD)) {
            var finallyToken = take();
            children.add(node(FINALLY_CLAUSE, List.of(finallyToken, parseBlock())));
        }
        if (children.size() == 2) {
            throw failure("'catch' or 'finally'");
        }
        return node(TRY_STATEMENT, children);
    }

    private SyntaxNode parseUsingStatement() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        if (!at(OPEN_PAREN_TOKEN)) {
            // using declaration: using var stream = ...;
            return parseLocalDeclaration(children);
        }
        children.add(take());
        int end = scanType(pos);
        if (end > 0 && kindAt(end) == IDENTIFIER_TOKEN && kindAt(end + 1) == EQUALS_TOKEN) {
            children.add(parseVariableDeclaration(parseType(true)));
        }else {
            children.add(parseExpression());
        }
        children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
        children.add(parseStatement());
        return node(USING_STATEMENT, children);
    }

    private SyntaxNode parseLock() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        parseParenthesizedCondition(children);
        children.add(parseStatement());
        return node(LOCK_STATEMENT, children);
    }

    private SyntaxNode parseSwitch() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        parseParenthesizedCondition(children);
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        while (!at(CLOSE_BRACE_TOKEN)) {
            children.add(parseSwitchSection());
        }
        children.add(take());
        return node(SWITCH_STATEMENT, children);
    }

    private SyntaxNode parseSwitchSection() {
        var children = new ArrayList<SyntaxElement>();
        while (isSwitchLabel()) {
            if (at(CASE_KEYWORD)) {
                var caseToken = take();
                var value = parseExpression();
                children.add(node(CASE_SWITCH_LABEL, List.of(caseToken, value, expect(COLON_TOKEN, "':'"))));
            }else {
                children.add(node(DEFAULT_SWITCH_LABEL, List.of(take(), take())));
            }
        }
        if (children.isEmpty()) {
            throw failure("'case' or 'default'");
        }
        while (!isSwitchLabel() && !at(CLOSE_BRACE_TOKEN)) {
            if (at(END_OF_FILE_TOKEN)) {
                throw failure("'}'");
            }
            children.add(parseStatement());
        }
        return node(SWITCH_SECTION, children);
    }

    private boolean isSwitchLabel() {
        return at(CASE_KEYWORD) || (at(DEFAULT_KEYWORD) && kind(1) == COLON_TOKEN);
    }

    private void parseParenthesizedCondition(List<SyntaxElement> children) {
        children.add(expect(OPEN_PAREN_TOKEN, "'('"));
        children.add(parseExpression());
        children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
    }

    // === Expressions ===

    private SyntaxNode parseExpression() {
        if (isLambdaStart()) {
            return parseLambda();
        }
        var left = parseConditional();
        int width = assignmentOperatorWidth();
        if (width == 0) {
            return left;
        }
        var children = new ArrayList<SyntaxElement>();
        children.add(left);
        for (int i = 0; i < width; i++) {
            children.add(take());
        }
        children.add(parseExpression());
        return node(ASSIGNMENT_EXPRESSION, children);
    }

    private int assignmentOperatorWidth() {
        if (ASSIGNMENT_OPERATORS.contains(kind(0))) {
            return 1;
        }
        // >>= is lexed as '>' followed by '>='
        return at(GREATER_THAN_TOKEN) && kind(1) == GREATER_THAN_EQUALS_TOKEN && adjacent(0)
               ? 2
               : 0;
    }

    private boolean isLambdaStart() {
        int start = 0;
        if (atContextual("async")) {
            if (kind(1) == DELEGATE_KEYWORD) {
                return true;
            }
            start = 1;
        }
        if (kind(start) == IDENTIFIER_TOKEN) {
            return kind(start + 1) == EQUALS_GREATER_THAN_TOKEN;
        }
        if (kind(start) == OPEN_PAREN_TOKEN) {
            int close = matchingParen(pos + start);
            return close > 0 && kindAt(close + 1) == EQUALS_GREATER_THAN_TOKEN;
        }
        return false;
    }

    private SyntaxNode parseLambda() {
        var children = new ArrayList<SyntaxElement>();
        if (atContextual("async")) {
            children.add(takeAs(ASYNC_KEYWORD));
        }
        if (at(DELEGATE_KEYWORD)) {
            return parseAnonymousMethod(children);
        }
        SyntaxKind lambdaKind;
        if (at(IDENTIFIER_TOKEN)) {
            children.add(node(PARAMETER, List.of(take())));
            lambdaKind = SIMPLE_LAMBDA_EXPRESSION;
        }else {
            children.add(parseLambdaParameterList());
            lambdaKind = PARENTHESIZED_LAMBDA_EXPRESSION;
        }
        children.add(expect(EQUALS_GREATER_THAN_TOKEN, "'=>'"));
        children.add(at(OPEN_BRACE_TOKEN)
                     ? parseBlock()
                     : parseExpression());
        return node(lambdaKind, children);
    }

    private SyntaxNode parseAnonymousMethod(List<SyntaxElement> children) {
        children.add(take());
        if (at(OPEN_PAREN_TOKEN)) {
            children.add(parseParameterList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, PARAMETER_LIST));
        }
        children.add(parseBlock());
        return node(ANONYMOUS_METHOD_EXPRESSION, children);
    }

    private SyntaxNode parseConditional() {
        var condition = parseNullCoalescing();
        if (!at(QUESTION_TOKEN)) {
            return condition;
        }
        var children = new ArrayList<SyntaxElement>();
        children.add(condition);
        children.add(take());
        children.add(parseExpression());
        children.add(expect(COLON_TOKEN, "':'"));
        children.add(parseExpression());
        return node(CONDITIONAL_EXPRESSION, children);
    }

    private SyntaxNode parseNullCoalescing() {
        var left = parseBinary(0);
        if (!at(QUESTION_QUESTION_TOKEN)) {
            return left;
        }
        var operator = take();
        return node(BINARY_EXPRESSION, List.of(left, operator, parseNullCoalescing()));
    }

    private SyntaxNode parseBinary(int level) {
        if (level == BINARY_LEVELS.size()) {
            return parseUnary();
        }
        var left = parseBinary(level + 1);
        while (true) {
            int width = binaryOperatorWidth(level);
            if (width == 0) {
                return left;
            }
            var children = new ArrayList<SyntaxElement>();
            children.add(left);
            boolean typeOperand = at(IS_KEYWORD) || at(AS_KEYWORD);
            for (int i = 0; i < width; i++) {
                children.add(take());
            }
            if (typeOperand) {
                parseTypeOperand(children);
            }else {
                children.add(parseBinary(level + 1));
            }
            left = node(BINARY_EXPRESSION, children);
        }
    }

    private int binaryOperatorWidth(int level) {
        var current = kind(0);
        if (!BINARY_LEVELS.get(level)
                          .contains(current)) {
            return 0;
        }
        if (current != GREATER_THAN_TOKEN) {
            return 1;
        }
        boolean shift = kind(1) == GREATER_THAN_TOKEN && adjacent(0);
        boolean shiftAssignment = kind(1) == GREATER_THAN_EQUALS_TOKEN && adjacent(0);
        if (level == SHIFT_LEVEL) {
            return shift
                   ? 2
                   : 0;
        }
        return level == RELATIONAL_LEVEL && !shift && !shiftAssignment
               ? 1
               : 0;
    }

    /**
     * Right-hand side of {@code is} and {@code as}: a type with an optional designation, or a constant pattern.
     */
    private void parseTypeOperand(List<SyntaxElement> children) {
        if (atContextual("not")) {
            children.add(take());
        }
        if (LITERALS.contains(kind(0)) || at(MINUS_TOKEN)) {
            children.add(parseUnary());
            return;
        }
        children.add(parseType(false));
        if (at(IDENTIFIER_TOKEN) && !atContextual("and") && !atContextual("or")) {
            children.add(take());
        }
    }

    private SyntaxNode parseUnary() {
        if (PREFIX_OPERATORS.contains(kind(0))) {
            var operator = take();
            return node(PREFIX_UNARY_EXPRESSION, List.of(operator, parseUnary()));
        }
        if (atContextual("await") && OPERAND_STARTS.contains(kind(1))) {
            var await = takeAs(AWAIT_KEYWORD);
            return node(AWAIT_EXPRESSION, List.of(await, parseUnary()));
        }
        if (at(OPEN_PAREN_TOKEN) && isCast()) {
            var children = new ArrayList<SyntaxElement>();
            children.add(take());
            children.add(parseType(true));
            children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
            children.add(parseUnary());
            return node(CAST_EXPRESSION, children);
        }
        return parsePostfix(parsePrimary());
    }

    private boolean isCast() {
        int end = scanType(pos + 1);
        if (end < 0 || kindAt(end) != CLOSE_PAREN_TOKEN) {
            return false;
        }
        var next = kindAt(end + 1);
        if (kindAt(pos + 1).isPredefinedType()) {
            return OPERAND_STARTS.contains(next) || PREFIX_OPERATORS.contains(next) || next.isPredefinedType();
        }
        return OPERAND_STARTS.contains(next) || next.isPredefinedType();
    }

    private SyntaxNode parsePostfix(SyntaxNode primary) {
        var expression = primary;
        while (true) {
            var current = kind(0);
            if (current == DOT_TOKEN) {
                var dot = take();
                expression = node(MEMBER_ACCESS_EXPRESSION, List.of(expression, dot, parseSimpleName()));
            }else if (current == QUESTION_DOT_TOKEN) {
                var dot = take();
                expression = node(CONDITIONAL_ACCESS_EXPRESSION, List.of(expression, dot, parseSimpleName()));
            }else if (current == QUESTION_TOKEN && kind(1) == OPEN_BRACKET_TOKEN && adjacent(0)) {
                var question = take();
                var arguments = parseArgumentList(OPEN_BRACKET_TOKEN, CLOSE_BRACKET_TOKEN, BRACKETED_ARGUMENT_LIST);
                expression = node(CONDITIONAL_ACCESS_EXPRESSION, List.of(expression, question, arguments));
            }else if (current == OPEN_PAREN_TOKEN) {
                var arguments = parseArgumentList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, ARGUMENT_LIST);
                expression = node(INVOCATION_EXPRESSION, List.of(expression, arguments));
            }else if (current == OPEN_BRACKET_TOKEN) {
                var arguments = parseArgumentList(OPEN_BRACKET_TOKEN, CLOSE_BRACKET_TOKEN, BRACKETED_ARGUMENT_LIST);
                expression = node(ELEMENT_ACCESS_EXPRESSION, List.of(expression, arguments));
            }else if (current == PLUS_PLUS_TOKEN || current == MINUS_MINUS_TOKEN) {
                expression = node(POSTFIX_UNARY_EXPRESSION, List.of(expression, take()));
            }else {
                return expression;
            }
        }
    }

    private SyntaxNode parsePrimary() {
        var current = kind(0);
        if (LITERALS.contains(current)) {
            return node(LITERAL_EXPRESSION, List.of(take()));
        }
        if (current.isPredefinedType()) {
            return node(PREDEFINED_TYPE, List.of(take()));
        }
        return switch (current) {
            case IDENTIFIER_TOKEN -> parseSimpleName();
            case THIS_KEYWORD -> node(THIS_EXPRESSION, List.of(take()));
            case BASE_KEYWORD -> node(BASE_EXPRESSION, List.of(take()));
            case OPEN_PAREN_TOKEN -> parseParenthesized();
            case NEW_KEYWORD -> parseCreation();
            case TYPEOF_KEYWORD -> parseTypeInParentheses(TYPEOF_EXPRESSION);
            case SIZEOF_KEYWORD -> parseTypeInParentheses(SIZEOF_EXPRESSION);
            case DEFAULT_KEYWORD -> kind(1) == OPEN_PAREN_TOKEN
                                    ? parseTypeInParentheses(DEFAULT_EXPRESSION)
                                    : node(LITERAL_EXPRESSION, List.of(take()));
            case CHECKED_KEYWORD, UNCHECKED_KEYWORD -> parseChecked();
            case DELEGATE_KEYWORD -> parseAnonymousMethod(new ArrayList<>());
            default -> throw failure("expression");
        };
    }

    private SyntaxNode parseSimpleName() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(IDENTIFIER_TOKEN, "identifier"));
        if (at(LESS_THAN_TOKEN)) {
            int end = scanTypeArguments(pos);
            if (end > 0 && (kindAt(end) == OPEN_PAREN_TOKEN || kindAt(end) == DOT_TOKEN)) {
                parseTypeArgumentList(children);
            }
        }
        return node(IDENTIFIER_NAME, children);
    }

    private SyntaxNode parseParenthesized() {
        var open = take();
        var inner = parseExpression();
        return node(PARENTHESIZED_EXPRESSION, List.of(open, inner, expect(CLOSE_PAREN_TOKEN, "')'")));
    }

    private SyntaxNode parseTypeInParentheses(SyntaxKind expressionKind) {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        children.add(expect(OPEN_PAREN_TOKEN, "'('"));
        children.add(parseType(true));
        children.add(expect(CLOSE_PAREN_TOKEN, "')'"));
        return node(expressionKind, children);
    }

    private SyntaxNode parseChecked() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        parseParenthesizedCondition(children);
        return node(CHECKED_EXPRESSION, children);
    }

    private SyntaxNode parseCreation() {
        var children = new ArrayList<SyntaxElement>();
        children.add(take());
        if (at(OPEN_BRACKET_TOKEN)) {
            // implicitly typed array: new[] { ... }
            children.add(take());
            while (at(COMMA_TOKEN)) {
                children.add(take());
            }
            children.add(expect(CLOSE_BRACKET_TOKEN, "']'"));
            children.add(parseInitializer());
            return node(ARRAY_CREATION_EXPRESSION, children);
        }
        if (at(OPEN_BRACE_TOKEN)) {
            children.add(parseInitializer());
            return node(OBJECT_CREATION_EXPRESSION, children);
        }
        if (at(OPEN_PAREN_TOKEN)) {
            children.add(parseArgumentList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, ARGUMENT_LIST));
            if (at(OPEN_BRACE_TOKEN)) {
                children.add(parseInitializer());
            }
            return node(OBJECT_CREATION_EXPRESSION, children);
        }
        var type = parseType(true);
        children.add(type);
        boolean array = type.lastToken()
                            .kind() == CLOSE_BRACKET_TOKEN;
        if (at(OPEN_BRACKET_TOKEN)) {
            children.add(parseArgumentList(OPEN_BRACKET_TOKEN, CLOSE_BRACKET_TOKEN, BRACKETED_ARGUMENT_LIST));
            while (at(OPEN_BRACKET_TOKEN) && (kind(1) == CLOSE_BRACKET_TOKEN || kind(1) == COMMA_TOKEN)) {
                children.add(take());
                while (at(COMMA_TOKEN)) {
                    children.add(take());
                }
                children.add(expect(CLOSE_BRACKET_TOKEN, "']'"));
            }
            array = true;
        }
        if (array) {
            if (at(OPEN_BRACE_TOKEN)) {
                children.add(parseInitializer());
            }
            return node(ARRAY_CREATION_EXPRESSION, children);
        }
        if (!at(OPEN_PAREN_TOKEN) && !at(OPEN_BRACE_TOKEN)) {
            throw failure("'(' or '{'");
        }
        if (at(OPEN_PAREN_TOKEN)) {
            children.add(parseArgumentList(OPEN_PAREN_TOKEN, CLOSE_PAREN_TOKEN, ARGUMENT_LIST));
        }
        if (at(OPEN_BRACE_TOKEN)) {
            children.add(parseInitializer());
        }
        return node(OBJECT_CREATION_EXPRESSION, children);
    }

    private SyntaxNode parseInitializer() {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(OPEN_BRACE_TOKEN, "'{'"));
        while (!at(CLOSE_BRACE_TOKEN)) {
            children.add(parseVariableInitializer());
            if (!at(COMMA_TOKEN)) {
                break;
            }
            children.add(take());
        }
        children.add(expect(CLOSE_BRACE_TOKEN, "'}'"));
        return node(INITIALIZER_EXPRESSION, children);
    }

    private SyntaxNode parseArgumentList(SyntaxKind open, SyntaxKind close, SyntaxKind listKind) {
        var children = new ArrayList<SyntaxElement>();
        children.add(expect(open, "'" + open.text() + "'"));
        if (!at(close)) {
            children.add(parseArgument());
            while (at(COMMA_TOKEN)) {
                children.add(take());
                children.add(parseArgument());
            }
        }
        children.add(expect(close, "'" + close.text() + "'"));
        return node(listKind, children);
    }

    private SyntaxNode parseArgument() {
        var children = new ArrayList<SyntaxElement>();
        if (at(IDENTIFIER_TOKEN) && kind(1) == COLON_TOKEN) {
            children.add(take());
            children.add(take());
        }
        if (at(REF_KEYWORD) || at(OUT_KEYWORD) || at(IN_KEYWORD)) {
            boolean out = at(OUT_KEYWORD);
            children.add(take());
            int end = scanType(pos);
            if (out && end > 0 && kindAt(end) == IDENTIFIER_TOKEN
                && (kindAt(end + 1) == COMMA_TOKEN || kindAt(end + 1) == CLOSE_PAREN_TOKEN)) {
                // out variable declaration
                children.add(parseType(true));
                children.add(take());
                return node(ARGUMENT, children);
            }
        }
        children.add(parseExpression());
        return node(ARGUMENT, children);
    }

    // === Token access ===

    private LexedToken current() {
        return tokens.get(pos);
    }

    private SyntaxKind kind(int ahead) {
        return kindAt(pos + ahead);
    }

    private SyntaxKind kindAt(int index) {
        return index < tokens.size()
               ? tokens.get(index)
                       .kind()
               : END_OF_FILE_TOKEN;
    }

    private boolean at(SyntaxKind expected) {
        return current().isKind(expected);
    }

    private boolean atContextual(String text) {
        return at(IDENTIFIER_TOKEN) && current().text()
                                                .equals(text);
    }

    /**
     * Whether the token at the relative offset touches the following one.
     */
    private boolean adjacent(int ahead) {
        int index = pos + ahead;
        return index + 1 < tokens.size() && tokens.get(index)
                                                  .isAdjacentTo(tokens.get(index + 1));
    }

    private SyntaxToken take() {
        var token = current().token();
        if (token.kind() != END_OF_FILE_TOKEN) {
            pos++ ;
        }
        return token;
    }

    private SyntaxToken takeAs(SyntaxKind contextualKind) {
        return take().withKind(contextualKind);
    }

    private SyntaxToken expect(SyntaxKind expected, String description) {
        if (!at(expected)) {
            throw failure(description);
        }
        if (expected == END_OF_FILE_TOKEN) {
            return current().token();
        }
        return take();
    }

    private int matchingParen(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            var k = kindAt(i);
            if (k == OPEN_PAREN_TOKEN) {
                depth++ ;
            }else if (k == CLOSE_PAREN_TOKEN && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private ParseFailure failure(String expected) {
        var token = current();
        var location = token.span()
                            .start();
        if (token.isKind(END_OF_FILE_TOKEN)) {
            return new ParseFailure(new ParseError.UnexpectedEof(location, expected));
        }
        return new ParseFailure(new ParseError.UnexpectedInput(location, token.text(), expected));
    }

    private static SyntaxNode node(SyntaxKind kind, List<SyntaxElement> children) {
        return new SyntaxNode(kind, children);
    }
}
