package com.worktrack.workitems.config;

import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets query parameters use the same lenient enum names as JSON bodies ({@code ?status=InProgress}).
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, WorkItemStatus.class,
            value -> value.isBlank() ? null : WorkItemStatus.fromValue(value));
        registry.addConverter(String.class, WorkItemPriority.class,
            value -> value.isBlank() ? null : WorkItemPriority.fromValue(value));
    }
}
