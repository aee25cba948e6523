package org.minilang.compiler.frontend;

/**
 * Defines the phases a MiniLang program passes through.
 * Errors are attributed to the phase that raised them.
 */
public enum CompilerPhase {
    /** Source text to tokens. */
    LEXING,
    /** Tokens to AST. */
    PARSING,
    /** Scope resolution and type checking of the AST. */
    SEMANTIC_ANALYSIS,
    /** Lowering of the checked AST to three-address code. */
    IR_GENERATION,
    /** Tree-walking execution of the checked AST. */
    EXECUTION
}
