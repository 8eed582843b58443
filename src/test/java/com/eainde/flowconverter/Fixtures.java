package com.eainde.flowconverter;

import com.eainde.flowconverter.codegen.CategoryNodeBodyGenerator;
import com.eainde.flowconverter.codegen.CodeEmitter;
import com.eainde.flowconverter.codegen.ConversionContext;
import com.eainde.flowconverter.codegen.EmittedProgram;
import com.eainde.flowconverter.config.ConverterSettings;
import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.document.FlowDocument;
import com.eainde.flowconverter.document.FlowDocumentLoader;
import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.edges.GuardCompiler;
import com.eainde.flowconverter.model.GraphModel;
import com.eainde.flowconverter.model.GraphModelBuilder;
import com.eainde.flowconverter.nodes.NodeCategory;
import com.eainde.flowconverter.nodes.NodeClassifier;
import com.eainde.flowconverter.state.StateSchemaInferencer;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test helpers: fixture lookup and a hand-wired pipeline up to emission.
 */
public final class Fixtures {

    private Fixtures() {}

    /** Path of {@code src/test/resources/flows/<name>}. */
    public static Path flow(String name) {
        URL url = Fixtures.class.getResource("/flows/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static GraphModel model(String name) {
        return new GraphModelBuilder().build(new FlowDocumentLoader(new ObjectMapper()).load(flow(name)));
    }

    public static ConversionContext context(String name) {
        return context(model(name));
    }

    public static ConversionContext context(GraphModel model) {
        NodeClassifier classifier = new NodeClassifier();
        Map<String, NodeCategory> classifications = new LinkedHashMap<>();
        for (NodeSpec node : model.nodes().values()) {
            classifications.put(node.id(), classifier.classify(node.classIdentifier()));
        }
        return new ConversionContext(model,
                new StateSchemaInferencer().infer(model, classifications),
                classifications,
                new GuardCompiler().compileAll(model),
                ConverterSettings.defaults());
    }

    public static CodeEmitter emitter() {
        return new CodeEmitter(new CategoryNodeBodyGenerator());
    }

    public static EmittedProgram emit(String name) {
        return emitter().emit(context(name));
    }

    public static GraphModel model(List<NodeSpec> nodes, List<EdgeSpec> edges) {
        return new GraphModelBuilder().build(new FlowDocument(nodes, edges));
    }
}
