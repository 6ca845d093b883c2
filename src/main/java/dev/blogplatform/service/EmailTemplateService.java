package dev.blogplatform.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Map;

/**
 * Renders HTML email bodies from {@code classpath:/templates/email/}.
 * <p>
 * Uses its own standalone Thymeleaf engine, so WebFlux gets no view resolver.
 * </p>
 */
@Service
@Slf4j
public class EmailTemplateService {

    private final TemplateEngine templateEngine;

    public EmailTemplateService() {
        var resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/email/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        log.info("Email templates resolved from classpath:templates/email/");
    }

    /**
     * @param templateName file name under {@code templates/email/} without the extension
     * @param variables    values exposed to the template as {@code ${key}}
     */
    public String render(String templateName, Map<String, Object> variables) {
        var context = new Context();
        context.setVariables(variables);
        return templateEngine.process(templateName, context);
    }
}
