package com.gridfeed.core.envelope;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders mutation documents from the {@code templates/mutation.hbs} classpath template.
 * Rendered text is cached per operation.
 */
public class MutationRenderer {
    private final Template template;
    private final Map<Operation, String> rendered = new EnumMap<>(Operation.class);

    public MutationRenderer() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates");
        loader.setSuffix(".hbs");
        Handlebars handlebars = new Handlebars(loader);
        try {
            this.template = handlebars.compile("mutation");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load mutation template", e);
        }
    }

    public String render(Operation operation) {
        return rendered.computeIfAbsent(operation, this::apply);
    }

    private String apply(Operation operation) {
        List<Map<String, Object>> arguments = new ArrayList<>();
        for (Argument argument : operation.arguments()) {
            Map<String, Object> arg = new HashMap<>();
            arg.put("variable", argument.variable());
            arg.put("name", argument.name());
            arg.put("type", argument.type());
            arguments.add(arg);
        }

        Map<String, Object> context = new HashMap<>();
        context.put("operationName", operation.operationName());
        context.put("field", operation.field());
        context.put("arguments", arguments);

        try {
            return template.apply(context);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render " + operation.field(), e);
        }
    }
}
