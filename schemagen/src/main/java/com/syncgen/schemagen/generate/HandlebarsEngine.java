package com.syncgen.schemagen.generate;

import com.github.jknack.handlebars.Context;
import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.context.FieldValueResolver;
import com.github.jknack.handlebars.context.JavaBeanValueResolver;
import com.github.jknack.handlebars.context.MapValueResolver;
import com.github.jknack.handlebars.context.MethodValueResolver;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.types.TypeMapper;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlebars template engine with the naming helpers used by the TypeScript templates.
 * <p>
 * Output is TypeScript, so HTML escaping is disabled. Record accessors resolve through
 * {@link MethodValueResolver}.
 */
public class HandlebarsEngine {
    private final Handlebars handlebars;
    private final Map<String, Template> compiled = new ConcurrentHashMap<>();

    public HandlebarsEngine() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader)
                .with(EscapingStrategy.NOOP)
                .prettyPrint(true);
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("pascalCase", (Helper<String>) (value, options) ->
                value == null ? "" : Inflector.pascalCase(value));

        handlebars.registerHelper("camelCase", (Helper<String>) (value, options) ->
                value == null ? "" : Inflector.camelCase(value));

        handlebars.registerHelper("humanize", (Helper<String>) (value, options) ->
                value == null ? "" : Inflector.humanize(value));

        // 'a' | 'b' from a list of values
        handlebars.registerHelper("union", (Helper<List<String>>) (values, options) ->
                values == null || values.isEmpty() ? "never" : TypeMapper.literalUnion(values));

        // single-quoted TypeScript string literal
        handlebars.registerHelper("quoted", (Helper<Object>) (value, options) -> {
            if (value == null) return "null";
            return TypeMapper.quote(value.toString());
        });
    }

    public Template compile(String templateName) throws IOException {
        Template template = compiled.get(templateName);
        if (template == null) {
            template = handlebars.compile(templateName);
            compiled.put(templateName, template);
        }
        return template;
    }

    public String render(String templateName, Object context) throws IOException {
        Context ctx = Context.newBuilder(context)
                .resolver(MapValueResolver.INSTANCE, JavaBeanValueResolver.INSTANCE,
                        MethodValueResolver.INSTANCE, FieldValueResolver.INSTANCE)
                .build();
        try {
            return compile(templateName).apply(ctx);
        } finally {
            ctx.destroy();
        }
    }
}
