package org.pseudoforge.compiler.backend.emit;

import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.frontend.parser.ParseResult;

/**
 * Turns a parsed program into text for one target.
 * Implementations are stateless and may be called from several threads at once.
 */
public interface ICodeEmitter {

    /**
     * @return The target this emitter writes.
     */
    TargetLanguage target();

    /**
     * Emits the whole program. Nothing is returned unless the text is complete.
     *
     * @param program The parsed program.
     * @return The generated text.
     */
    String emit(ParseResult program);
}
