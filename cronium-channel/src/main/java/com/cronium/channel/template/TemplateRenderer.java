package com.cronium.channel.template;

import java.util.Map;

/**
 * Turns a message template plus a context into final text. Renderers never
 * throw: a template they cannot process comes back with an error notice.
 */
public interface TemplateRenderer {

    String render(String template, Map<String, Object> context);

    default String render(String template, TemplateContext context) {
        return render(template, context.toMap());
    }
}
