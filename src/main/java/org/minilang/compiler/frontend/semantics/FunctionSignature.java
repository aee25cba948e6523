package org.minilang.compiler.frontend.semantics;

import org.minilang.compiler.frontend.parser.ast.FunctionDeclNode;
import org.minilang.compiler.frontend.parser.ast.Parameter;

import java.util.List;

/**
 * The signature of a declared function, as collected in the first analysis pass.
 *
 * @param name The function name.
 * @param parameterTypes The parameter types in declaration order.
 * @param returnType The declared return type.
 * @param declaration The declaring AST node.
 */
public record FunctionSignature(String name, List<String> parameterTypes, String returnType, FunctionDeclNode declaration) {

    public FunctionSignature {
        parameterTypes = List.copyOf(parameterTypes);
    }

    /**
     * Builds the signature of a function declaration.
     * @param declaration The declaration.
     * @return The signature.
     */
    public static FunctionSignature of(FunctionDeclNode declaration) {
        List<String> types = declaration.parameters().stream().map(Parameter::typeName).toList();
        return new FunctionSignature(declaration.name(), types, declaration.returnType(), declaration);
    }
}
