package com.eainde.flowconverter.validation;

import com.eainde.flowconverter.codegen.CodeEmitter;
import com.eainde.flowconverter.codegen.ConversionContext;
import com.eainde.flowconverter.codegen.CustomLogicBlock;
import com.eainde.flowconverter.codegen.EmittedProgram;
import com.eainde.flowconverter.codegen.PythonIdentifiers;
import com.eainde.flowconverter.document.NodeSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds an emitted program with its custom logic made well-formed.
 *
 * <p>Every node's custom logic is judged on its own, starting from the logic
 * in the flow document:</p>
 * <ol>
 *   <li>valid as written: kept;</li>
 *   <li>valid after {@link LogicNormalizer}: the normalized text replaces it;</li>
 *   <li>otherwise: dropped, the node is generated from its category template.</li>
 * </ol>
 *
 * <p>The program is then emitted again from the same context with those
 * decisions applied. Nothing is patched in the emitted text. A program whose
 * custom logic is all valid comes back unchanged.</p>
 */
@Slf4j
@Component
public class ProgramRepairer {

    private final CodeEmitter emitter;

    public ProgramRepairer(CodeEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    public EmittedProgram repair(EmittedProgram program) {
        Objects.requireNonNull(program, "program");
        ConversionContext context = program.context();
        Map<String, String> names = PythonIdentifiers.functionNames(context.model().nodes().values());

        Map<String, String> overrides = new LinkedHashMap<>();
        Set<String> discarded = new LinkedHashSet<>();
        for (NodeSpec node : context.model().nodes().values()) {
            Optional<String> logic = node.customLogic();
            if (logic.isEmpty()) {
                continue;
            }
            String name = names.get(node.id());
            if (PythonSyntaxChecker.isValid(CustomLogicBlock.of(logic.get(), name).source())) {
                continue;
            }
            String normalized = LogicNormalizer.normalize(logic.get());
            if (PythonSyntaxChecker.isValid(CustomLogicBlock.of(normalized, name).source())) {
                log.info("Re-indented custom logic of node '{}'", node.id());
                overrides.put(node.id(), normalized);
            } else {
                log.warn("Custom logic of node '{}' is not valid Python, using the {} template instead",
                        node.id(), context.categoryOf(node.id()).code());
                discarded.add(node.id());
            }
        }

        if (overrides.isEmpty() && discarded.isEmpty() && !context.isRepaired()) {
            log.debug("No custom logic needed repair");
            return program;
        }
        return emitter.emit(context.withRepairs(overrides, discarded));
    }
}
