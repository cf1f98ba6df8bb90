package org.pragmatica.sharplint.tree;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Kind tag of every token and node in a C# syntax tree.
 */
public enum SyntaxKind {
    // Tokens with variable text
    IDENTIFIER_TOKEN(Category.TOKEN),
    NUMERIC_LITERAL_TOKEN(Category.TOKEN),
    STRING_LITERAL_TOKEN(Category.TOKEN),
    CHARACTER_LITERAL_TOKEN(Category.TOKEN),
    BAD_TOKEN(Category.TOKEN),
    END_OF_FILE_TOKEN(Category.TOKEN),

    // Punctuation
    OPEN_BRACE_TOKEN("{"),
    CLOSE_BRACE_TOKEN("}"),
    OPEN_PAREN_TOKEN("("),
    CLOSE_PAREN_TOKEN(")"),
    OPEN_BRACKET_TOKEN("["),
    CLOSE_BRACKET_TOKEN("]"),
    SEMICOLON_TOKEN(";"),
    COMMA_TOKEN(","),
    DOT_TOKEN("."),
    COLON_TOKEN(":"),
    QUESTION_TOKEN("?"),
    QUESTION_DOT_TOKEN("?."),
    QUESTION_QUESTION_TOKEN("??"),
    QUESTION_QUESTION_EQUALS_TOKEN("??="),
    EQUALS_GREATER_THAN_TOKEN("=>"),
    EQUALS_TOKEN("="),
    EQUALS_EQUALS_TOKEN("=="),
    EXCLAMATION_EQUALS_TOKEN("!="),
    LESS_THAN_TOKEN("<"),
    GREATER_THAN_TOKEN(">"),
    LESS_THAN_EQUALS_TOKEN("<="),
    GREATER_THAN_EQUALS_TOKEN(">="),
    LESS_THAN_LESS_THAN_TOKEN("<<"),
    LESS_THAN_LESS_THAN_EQUALS_TOKEN("<<="),
    PLUS_TOKEN("+"),
    MINUS_TOKEN("-"),
    ASTERISK_TOKEN("*"),
    SLASH_TOKEN("/"),
    PERCENT_TOKEN("%"),
    EXCLAMATION_TOKEN("!"),
    TILDE_TOKEN("~"),
    AMPERSAND_TOKEN("&"),
    AMPERSAND_AMPERSAND_TOKEN("&&"),
    BAR_TOKEN("|"),
    BAR_BAR_TOKEN("||"),
    CARET_TOKEN("^"),
    PLUS_PLUS_TOKEN("++"),
    MINUS_MINUS_TOKEN("--"),
    PLUS_EQUALS_TOKEN("+="),
    MINUS_EQUALS_TOKEN("-="),
    ASTERISK_EQUALS_TOKEN("*="),
    SLASH_EQUALS_TOKEN("/="),
    PERCENT_EQUALS_TOKEN("%="),
    AMPERSAND_EQUALS_TOKEN("&="),
    BAR_EQUALS_TOKEN("|="),
    CARET_EQUALS_TOKEN("^="),

    // Reserved keywords
    ABSTRACT_KEYWORD(Category.KEYWORD),
    AS_KEYWORD(Category.KEYWORD),
    BASE_KEYWORD(Category.KEYWORD),
    BOOL_KEYWORD(Category.KEYWORD),
    BREAK_KEYWORD(Category.KEYWORD),
    BYTE_KEYWORD(Category.KEYWORD),
    CASE_KEYWORD(Category.KEYWORD),
    CATCH_KEYWORD(Category.KEYWORD),
    CHAR_KEYWORD(Category.KEYWORD),
    CHECKED_KEYWORD(Category.KEYWORD),
    CLASS_KEYWORD(Category.KEYWORD),
    CONST_KEYWORD(Category.KEYWORD),
    CONTINUE_KEYWORD(Category.KEYWORD),
    DECIMAL_KEYWORD(Category.KEYWORD),
    DEFAULT_KEYWORD(Category.KEYWORD),
    DELEGATE_KEYWORD(Category.KEYWORD),
    DO_KEYWORD(Category.KEYWORD),
    DOUBLE_KEYWORD(Category.KEYWORD),
    ELSE_KEYWORD(Category.KEYWORD),
    ENUM_KEYWORD(Category.KEYWORD),
    EVENT_KEYWORD(Category.KEYWORD),
    EXPLICIT_KEYWORD(Category.KEYWORD),
    EXTERN_KEYWORD(Category.KEYWORD),
    FALSE_KEYWORD(Category.KEYWORD),
    FINALLY_KEYWORD(Category.KEYWORD),
    FIXED_KEYWORD(Category.KEYWORD),
    FLOAT_KEYWORD(Category.KEYWORD),
    FOR_KEYWORD(Category.KEYWORD),
    FOREACH_KEYWORD(Category.KEYWORD),
    GOTO_KEYWORD(Category.KEYWORD),
    IF_KEYWORD(Category.KEYWORD),
    IMPLICIT_KEYWORD(Category.KEYWORD),
    IN_KEYWORD(Category.KEYWORD),
    INT_KEYWORD(Category.KEYWORD),
    INTERFACE_KEYWORD(Category.KEYWORD),
    INTERNAL_KEYWORD(Category.KEYWORD),
    IS_KEYWORD(Category.KEYWORD),
    LOCK_KEYWORD(Category.KEYWORD),
    LONG_KEYWORD(Category.KEYWORD),
    NAMESPACE_KEYWORD(Category.KEYWORD),
    NEW_KEYWORD(Category.KEYWORD),
    NULL_KEYWORD(Category.KEYWORD),
    OBJECT_KEYWORD(Category.KEYWORD),
    OPERATOR_KEYWORD(Category.KEYWORD),
    OUT_KEYWORD(Category.KEYWORD),
    OVERRIDE_KEYWORD(Category.KEYWORD),
    PARAMS_KEYWORD(Category.KEYWORD),
    PRIVATE_KEYWORD(Category.KEYWORD),
    PROTECTED_KEYWORD(Category.KEYWORD),
    PUBLIC_KEYWORD(Category.KEYWORD),
    READONLY_KEYWORD(Category.KEYWORD),
    REF_KEYWORD(Category.KEYWORD),
    RETURN_KEYWORD(Category.KEYWORD),
    SBYTE_KEYWORD(Category.KEYWORD),
    SEALED_KEYWORD(Category.KEYWORD),
    SHORT_KEYWORD(Category.KEYWORD),
    SIZEOF_KEYWORD(Category.KEYWORD),
    STACKALLOC_KEYWORD(Category.KEYWORD),
    STATIC_KEYWORD(Category.KEYWORD),
    STRING_KEYWORD(Category.KEYWORD),
    STRUCT_KEYWORD(Category.KEYWORD),
    SWITCH_KEYWORD(Category.KEYWORD),
    THIS_KEYWORD(Category.KEYWORD),
    THROW_KEYWORD(Category.KEYWORD),
    TRUE_KEYWORD(Category.KEYWORD),
    TRY_KEYWORD(Category.KEYWORD),
    TYPEOF_KEYWORD(Category.KEYWORD),
    UINT_KEYWORD(Category.KEYWORD),
    ULONG_KEYWORD(Category.KEYWORD),
    UNCHECKED_KEYWORD(Category.KEYWORD),
    UNSAFE_KEYWORD(Category.KEYWORD),
    USHORT_KEYWORD(Category.KEYWORD),
    USING_KEYWORD(Category.KEYWORD),
    VIRTUAL_KEYWORD(Category.KEYWORD),
    VOID_KEYWORD(Category.KEYWORD),
    VOLATILE_KEYWORD(Category.KEYWORD),
    WHILE_KEYWORD(Category.KEYWORD),

    // Contextual keywords: lexed as identifiers, re-kinded by the parser where they act as keywords
    PARTIAL_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    ASYNC_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    AWAIT_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    GET_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    SET_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    INIT_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    ADD_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    REMOVE_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    WHERE_KEYWORD(Category.CONTEXTUAL_KEYWORD),
    YIELD_KEYWORD(Category.CONTEXTUAL_KEYWORD),

    // Declarations
    COMPILATION_UNIT(Category.NODE),
    USING_DIRECTIVE(Category.NODE),
    NAMESPACE_DECLARATION(Category.NODE),
    CLASS_DECLARATION(Category.NODE),
    STRUCT_DECLARATION(Category.NODE),
    INTERFACE_DECLARATION(Category.NODE),
    ENUM_DECLARATION(Category.NODE),
    ENUM_MEMBER_DECLARATION(Category.NODE),
    DELEGATE_DECLARATION(Category.NODE),
    FIELD_DECLARATION(Category.NODE),
    EVENT_FIELD_DECLARATION(Category.NODE),
    EVENT_DECLARATION(Category.NODE),
    PROPERTY_DECLARATION(Category.NODE),
    INDEXER_DECLARATION(Category.NODE),
    METHOD_DECLARATION(Category.NODE),
    CONSTRUCTOR_DECLARATION(Category.NODE),
    DESTRUCTOR_DECLARATION(Category.NODE),
    OPERATOR_DECLARATION(Category.NODE),
    CONVERSION_OPERATOR_DECLARATION(Category.NODE),

    // Declaration parts
    ATTRIBUTE_LIST(Category.NODE),
    TYPE_PARAMETER_LIST(Category.NODE),
    TYPE_PARAMETER_CONSTRAINT_CLAUSE(Category.NODE),
    BASE_LIST(Category.NODE),
    PARAMETER_LIST(Category.NODE),
    BRACKETED_PARAMETER_LIST(Category.NODE),
    PARAMETER(Category.NODE),
    CONSTRUCTOR_INITIALIZER(Category.NODE),
    ACCESSOR_LIST(Category.NODE),
    ACCESSOR_DECLARATION(Category.NODE),
    ARROW_EXPRESSION_CLAUSE(Category.NODE),
    EQUALS_VALUE_CLAUSE(Category.NODE),
    VARIABLE_DECLARATION(Category.NODE),
    VARIABLE_DECLARATOR(Category.NODE),
    NAME(Category.NODE),
    TYPE(Category.NODE),
    TYPE_ARGUMENT_LIST(Category.NODE),

    // Statements
    BLOCK(Category.NODE),
    EMPTY_STATEMENT(Category.NODE),
    LOCAL_DECLARATION_STATEMENT(Category.NODE),
    EXPRESSION_STATEMENT(Category.NODE),
    IF_STATEMENT(Category.NODE),
    ELSE_CLAUSE(Category.NODE),
    WHILE_STATEMENT(Category.NODE),
    DO_STATEMENT(Category.NODE),
    FOR_STATEMENT(Category.NODE),
    FOREACH_STATEMENT(Category.NODE),
    RETURN_STATEMENT(Category.NODE),
    THROW_STATEMENT(Category.NODE),
    BREAK_STATEMENT(Category.NODE),
    CONTINUE_STATEMENT(Category.NODE),
    YIELD_RETURN_STATEMENT(Category.NODE),
    YIELD_BREAK_STATEMENT(Category.NODE),
    TRY_STATEMENT(Category.NODE),
    CATCH_CLAUSE(Category.NODE),
    CATCH_DECLARATION(Category.NODE),
    FINALLY_CLAUSE(Category.NODE),
    USING_STATEMENT(Category.NODE),
    LOCK_STATEMENT(Category.NODE),
    SWITCH_STATEMENT(Category.NODE),
    SWITCH_SECTION(Category.NODE),
    CASE_SWITCH_LABEL(Category.NODE),
    DEFAULT_SWITCH_LABEL(Category.NODE),

    // Expressions
    IDENTIFIER_NAME(Category.NODE),
    PREDEFINED_TYPE(Category.NODE),
    LITERAL_EXPRESSION(Category.NODE),
    THIS_EXPRESSION(Category.NODE),
    BASE_EXPRESSION(Category.NODE),
    PARENTHESIZED_EXPRESSION(Category.NODE),
    MEMBER_ACCESS_EXPRESSION(Category.NODE),
    CONDITIONAL_ACCESS_EXPRESSION(Category.NODE),
    INVOCATION_EXPRESSION(Category.NODE),
    ELEMENT_ACCESS_EXPRESSION(Category.NODE),
    ARGUMENT_LIST(Category.NODE),
    BRACKETED_ARGUMENT_LIST(Category.NODE),
    ARGUMENT(Category.NODE),
    OBJECT_CREATION_EXPRESSION(Category.NODE),
    ARRAY_CREATION_EXPRESSION(Category.NODE),
    INITIALIZER_EXPRESSION(Category.NODE),
    TYPEOF_EXPRESSION(Category.NODE),
    DEFAULT_EXPRESSION(Category.NODE),
    SIZEOF_EXPRESSION(Category.NODE),
    CHECKED_EXPRESSION(Category.NODE),
    CAST_EXPRESSION(Category.NODE),
    AWAIT_EXPRESSION(Category.NODE),
    PREFIX_UNARY_EXPRESSION(Category.NODE),
    POSTFIX_UNARY_EXPRESSION(Category.NODE),
    BINARY_EXPRESSION(Category.NODE),
    CONDITIONAL_EXPRESSION(Category.NODE),
    ASSIGNMENT_EXPRESSION(Category.NODE),
    SIMPLE_LAMBDA_EXPRESSION(Category.NODE),
    PARENTHESIZED_LAMBDA_EXPRESSION(Category.NODE),
    ANONYMOUS_METHOD_EXPRESSION(Category.NODE);

    private enum Category {
        TOKEN,
        PUNCTUATION,
        KEYWORD,
        CONTEXTUAL_KEYWORD,
        NODE
    }

    private final Category category;
    private final String text;

    SyntaxKind(Category category) {
        this.category = category;
        this.text = switch (category) {
            case KEYWORD, CONTEXTUAL_KEYWORD -> name().substring(0, name().length() - "_KEYWORD".length())
                                                      .toLowerCase();
            default -> "";
        };
    }

    SyntaxKind(String punctuation) {
        this.category = Category.PUNCTUATION;
        this.text = punctuation;
    }

    private static final Map<String, SyntaxKind> KEYWORDS = new HashMap<>();
    private static final Map<String, SyntaxKind> CONTEXTUAL_KEYWORDS = new HashMap<>();
    private static final Map<String, SyntaxKind> PUNCTUATION = new HashMap<>();

    static {
        for (var kind : values()) {
            switch (kind.category) {
                case KEYWORD -> KEYWORDS.put(kind.text, kind);
                case CONTEXTUAL_KEYWORD -> CONTEXTUAL_KEYWORDS.put(kind.text, kind);
                case PUNCTUATION -> PUNCTUATION.put(kind.text, kind);
                default -> {}
            }
        }
    }

    private static final Set<SyntaxKind> ACCESS_MODIFIERS = EnumSet.of(PUBLIC_KEYWORD,
                                                                        PRIVATE_KEYWORD,
                                                                        PROTECTED_KEYWORD,
                                                                        INTERNAL_KEYWORD);

    private static final Set<SyntaxKind> MODIFIERS = EnumSet.of(PUBLIC_KEYWORD,
                                                                 PRIVATE_KEYWORD,
                                                                 PROTECTED_KEYWORD,
                                                                 INTERNAL_KEYWORD,
                                                                 STATIC_KEYWORD,
                                                                 READONLY_KEYWORD,
                                                                 CONST_KEYWORD,
                                                                 VIRTUAL_KEYWORD,
                                                                 OVERRIDE_KEYWORD,
                                                                 ABSTRACT_KEYWORD,
                                                                 SEALED_KEYWORD,
                                                                 EXTERN_KEYWORD,
                                                                 NEW_KEYWORD,
                                                                 UNSAFE_KEYWORD,
                                                                 VOLATILE_KEYWORD,
                                                                 FIXED_KEYWORD,
                                                                 PARTIAL_KEYWORD,
                                                                 ASYNC_KEYWORD);

    private static final Set<SyntaxKind> PREDEFINED_TYPES = EnumSet.of(BOOL_KEYWORD,
                                                                        BYTE_KEYWORD,
                                                                        CHAR_KEYWORD,
                                                                        DECIMAL_KEYWORD,
                                                                        DOUBLE_KEYWORD,
                                                                        FLOAT_KEYWORD,
                                                                        INT_KEYWORD,
                                                                        LONG_KEYWORD,
                                                                        OBJECT_KEYWORD,
                                                                        SBYTE_KEYWORD,
                                                                        SHORT_KEYWORD,
                                                                        STRING_KEYWORD,
                                                                        UINT_KEYWORD,
                                                                        ULONG_KEYWORD,
                                                                        USHORT_KEYWORD,
                                                                        VOID_KEYWORD);

    private static final Set<SyntaxKind> STATEMENTS = EnumSet.of(BLOCK,
                                                                  EMPTY_STATEMENT,
                                                                  LOCAL_DECLARATION_STATEMENT,
                                                                  EXPRESSION_STATEMENT,
                                                                  IF_STATEMENT,
                                                                  WHILE_STATEMENT,
                                                                  DO_STATEMENT,
                                                                  FOR_STATEMENT,
                                                                  FOREACH_STATEMENT,
                                                                  RETURN_STATEMENT,
                                                                  THROW_STATEMENT,
                                                                  BREAK_STATEMENT,
                                                                  CONTINUE_STATEMENT,
                                                                  YIELD_RETURN_STATEMENT,
                                                                  YIELD_BREAK_STATEMENT,
                                                                  TRY_STATEMENT,
                                                                  USING_STATEMENT,
                                                                  LOCK_STATEMENT,
                                                                  SWITCH_STATEMENT);

    private static final Set<SyntaxKind> TYPE_DECLARATIONS = EnumSet.of(CLASS_DECLARATION,
                                                                         STRUCT_DECLARATION,
                                                                         INTERFACE_DECLARATION,
                                                                         ENUM_DECLARATION);

    private static final Set<SyntaxKind> MEMBER_DECLARATIONS = EnumSet.of(NAMESPACE_DECLARATION,
                                                                           CLASS_DECLARATION,
                                                                           STRUCT_DECLARATION,
                                                                           INTERFACE_DECLARATION,
                                                                           ENUM_DECLARATION,
                                                                           ENUM_MEMBER_DECLARATION,
                                                                           DELEGATE_DECLARATION,
                                                                           FIELD_DECLARATION,
                                                                           EVENT_FIELD_DECLARATION,
                                                                           EVENT_DECLARATION,
                                                                           PROPERTY_DECLARATION,
                                                                           INDEXER_DECLARATION,
                                                                           METHOD_DECLARATION,
                                                                           CONSTRUCTOR_DECLARATION,
                                                                           DESTRUCTOR_DECLARATION,
                                                                           OPERATOR_DECLARATION,
                                                                           CONVERSION_OPERATOR_DECLARATION,
                                                                           ACCESSOR_DECLARATION);

    private static final Set<SyntaxKind> ANONYMOUS_FUNCTIONS = EnumSet.of(SIMPLE_LAMBDA_EXPRESSION,
                                                                           PARENTHESIZED_LAMBDA_EXPRESSION,
                                                                           ANONYMOUS_METHOD_EXPRESSION);

    /**
     * Fixed text of punctuation and keywords, empty for tokens with variable text and for nodes.
     */
    public String text() {
        return text;
    }

    public boolean isToken() {
        return category != Category.NODE;
    }

    public boolean isNode() {
        return category == Category.NODE;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD || category == Category.CONTEXTUAL_KEYWORD;
    }

    public boolean isPunctuation() {
        return category == Category.PUNCTUATION;
    }

    public boolean isAccessModifier() {
        return ACCESS_MODIFIERS.contains(this);
    }

    public boolean isModifier() {
        return MODIFIERS.contains(this);
    }

    public boolean isPredefinedType() {
        return PREDEFINED_TYPES.contains(this);
    }

    public boolean isStatement() {
        return STATEMENTS.contains(this);
    }

    public boolean isTypeDeclaration() {
        return TYPE_DECLARATIONS.contains(this);
    }

    public boolean isMemberDeclaration() {
        return MEMBER_DECLARATIONS.contains(this);
    }

    public boolean isAnonymousFunction() {
        return ANONYMOUS_FUNCTIONS.contains(this);
    }

    /**
     * Reserved keyword spelled exactly as {@code text}.
     */
    public static Optional<SyntaxKind> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /**
     * Contextual keyword spelled exactly as {@code text}, for example {@code partial} or {@code get}.
     */
    public static Optional<SyntaxKind> contextualKeyword(String text) {
        return Optional.ofNullable(CONTEXTUAL_KEYWORDS.get(text));
    }

    public static Optional<SyntaxKind> punctuation(String text) {
        return Optional.ofNullable(PUNCTUATION.get(text));
    }

    /**
     * All punctuation spellings, longest first, for maximal-munch lexing.
     */
    public static List<String> punctuationByLength() {
        return PUNCTUATION_BY_LENGTH;
    }

    private static final List<String> PUNCTUATION_BY_LENGTH = PUNCTUATION.keySet()
                                                                          .stream()
                                                                          .sorted((a, b) -> Integer.compare(b.length(),
                                                                                                            a.length()))
                                                                          .toList();
}
