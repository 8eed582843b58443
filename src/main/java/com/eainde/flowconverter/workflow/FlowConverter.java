package com.eainde.flowconverter.workflow;

import com.eainde.flowconverter.codegen.CodeEmitter;
import com.eainde.flowconverter.codegen.ConversionContext;
import com.eainde.flowconverter.codegen.EmittedProgram;
import com.eainde.flowconverter.config.ConverterSettings;
import com.eainde.flowconverter.document.FlowDocument;
import com.eainde.flowconverter.document.FlowDocumentLoader;
import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.edges.GuardCompiler;
import com.eainde.flowconverter.edges.RoutingPlan;
import com.eainde.flowconverter.exception.CodeGenerationException;
import com.eainde.flowconverter.exception.ConversionException;
import com.eainde.flowconverter.exception.FlowConverterException;
import com.eainde.flowconverter.exception.ProgramValidationException;
import com.eainde.flowconverter.model.GraphModel;
import com.eainde.flowconverter.model.GraphModelBuilder;
import com.eainde.flowconverter.nodes.NodeCategory;
import com.eainde.flowconverter.nodes.NodeClassifier;
import com.eainde.flowconverter.state.StateSchema;
import com.eainde.flowconverter.state.StateSchemaInferencer;
import com.eainde.flowconverter.validation.ProgramRepairer;
import com.eainde.flowconverter.validation.ProgramValidator;
import com.eainde.flowconverter.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a Langflow flow document into a runnable LangGraph Python module.
 *
 * <pre>
 *   load → build model → classify → infer state → compile guards → emit
 *        → validate [→ repair → validate]  (repair at most once)
 *        → write
 * </pre>
 *
 * <p>Every failure reaches the caller as a {@link ConversionException} tagged
 * with its {@link ConversionException.ErrorKind}, and is logged here once.
 * The output file is only written after the whole pipeline succeeded.</p>
 */
@Slf4j
@Component
public class FlowConverter {

    private final FlowDocumentLoader loader;
    private final GraphModelBuilder modelBuilder;
    private final NodeClassifier classifier;
    private final StateSchemaInferencer schemaInferencer;
    private final GuardCompiler guardCompiler;
    private final CodeEmitter emitter;
    private final ProgramValidator validator;
    private final ProgramRepairer repairer;
    private final ConverterSettings settings;

    public FlowConverter(FlowDocumentLoader loader,
                         GraphModelBuilder modelBuilder,
                         NodeClassifier classifier,
                         StateSchemaInferencer schemaInferencer,
                         GuardCompiler guardCompiler,
                         CodeEmitter emitter,
                         ProgramValidator validator,
                         ProgramRepairer repairer,
                         ConverterSettings settings) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.modelBuilder = Objects.requireNonNull(modelBuilder, "modelBuilder");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.schemaInferencer = Objects.requireNonNull(schemaInferencer, "schemaInferencer");
        this.guardCompiler = Objects.requireNonNull(guardCompiler, "guardCompiler");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.repairer = Objects.requireNonNull(repairer, "repairer");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** Converts with the configured validate flag, without writing a file. */
    public String convert(Path input) {
        return convert(input, null, settings.isValidate());
    }

    /**
     * @param input    the flow document
     * @param output   where to write the module, {@code null} to only return it
     * @param validate whether to validate (and if needed repair) the emitted module
     * @return the generated Python source
     * @throws ConversionException on any failure; nothing is written in that case
     */
    public String convert(Path input, Path output, boolean validate) {
        Objects.requireNonNull(input, "input");
        log.info("Converting {}{}", input, output != null ? " -> " + output : "");
        try {
            EmittedProgram program = generate(input);
            if (validate) {
                program = validated(program);
            }
            String source = program.source();
            if (output != null) {
                write(source, output);
            }
            log.info("Conversion of {} finished: {} lines", input, source.lines().count());
            return source;
        } catch (FlowConverterException e) {
            log.error("Conversion of {} failed ({}): {}", input, e.kind(), e.getMessage());
            throw ConversionException.wrap(e);
        }
    }

    private EmittedProgram generate(Path input) {
        FlowDocument document = loader.load(input);
        GraphModel model = modelBuilder.build(document);

        Map<String, NodeCategory> classifications = new LinkedHashMap<>();
        for (NodeSpec node : model.nodes().values()) {
            classifications.put(node.id(), classifier.classify(node.classIdentifier()));
        }
        StateSchema schema = schemaInferencer.infer(model, classifications);
        Map<String, RoutingPlan> plans = guardCompiler.compileAll(model);

        return emitter.emit(new ConversionContext(model, schema, classifications, plans, settings));
    }

    private EmittedProgram validated(EmittedProgram program) {
        ValidationResult result = validator.validate(program);
        if (result.isValid()) {
            return program;
        }

        log.warn("Generated program has {} issues, attempting repair: {}",
                result.issues().size(), result.messages());
        EmittedProgram repaired = repairer.repair(program);
        ValidationResult afterRepair = validator.validate(repaired);
        if (!afterRepair.isValid()) {
            throw new ProgramValidationException(afterRepair.messages());
        }
        log.info("Repaired program passed validation");
        return repaired;
    }

    /** Writes to a sibling temp file first, so a failed write never leaves a partial module. */
    private void write(String source, Path output) {
        Path target = output.toAbsolutePath();
        Path temp = null;
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(source);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote {} characters to {}", source.length(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CodeGenerationException("Error writing output file " + output + ": " + e.getMessage(), e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
