package com.scadlang.compiler.parser;

import com.scadlang.compiler.cst.CstTree;
import com.scadlang.compiler.cst.SyntaxParser;
import com.scadlang.compiler.lexer.Lexer;

/**
 * 基于 {@link Parser} 的 {@link SyntaxParser} 实现
 */
public class ScadSyntaxParser implements SyntaxParser {

    @Override
    public CstTree parse(String source) {
        String text = source != null ? source : "";
        return new Parser(new Lexer(text), text).parse();
    }
}
