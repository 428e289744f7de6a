package org.pseudoforge.compiler.backend.emit;

import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.backend.emit.targets.CSharpEmitter;
import org.pseudoforge.compiler.backend.emit.targets.CppEmitter;
import org.pseudoforge.compiler.backend.emit.targets.GoEmitter;
import org.pseudoforge.compiler.backend.emit.targets.JavaEmitter;
import org.pseudoforge.compiler.backend.emit.targets.JavaScriptEmitter;
import org.pseudoforge.compiler.backend.emit.targets.PseudocodeEmitter;
import org.pseudoforge.compiler.backend.emit.targets.PythonEmitter;
import org.pseudoforge.compiler.backend.emit.targets.RustEmitter;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the emitter for each target.
 */
public final class EmitterRegistry {

	private final Map<TargetLanguage, ICodeEmitter> emitters = new EnumMap<>(TargetLanguage.class);

	/**
	 * Registers an emitter, replacing any emitter registered for the same target.
	 * @param emitter The emitter to register.
	 */
	public void register(ICodeEmitter emitter) { emitters.put(emitter.target(), emitter); }

	/**
	 * @param target The target.
	 * @return The emitter for the target, if one is registered.
	 */
	public Optional<ICodeEmitter> get(TargetLanguage target) { return Optional.ofNullable(emitters.get(target)); }

	/**
	 * Initializes a new registry with an emitter for every target.
	 * @param indentWidth The number of spaces per nesting level.
	 * @return A new registry with the default emitters.
	 */
	public static EmitterRegistry initializeWithDefaults(int indentWidth) {
		EmitterRegistry reg = new EmitterRegistry();
		reg.register(new PseudocodeEmitter(indentWidth));
		reg.register(new PythonEmitter(indentWidth));
		reg.register(new JavaScriptEmitter(indentWidth));
		reg.register(new JavaEmitter(indentWidth));
		reg.register(new CSharpEmitter(indentWidth));
		reg.register(new CppEmitter(indentWidth));
		reg.register(new GoEmitter(indentWidth));
		reg.register(new RustEmitter(indentWidth));
		return reg;
	}
}
