package com.worktrack.workitems.config;

import com.worktrack.workitems.domain.WorkItemPriority;
import com.worktrack.workitems.domain.WorkItemStatus;
import com.worktrack.workitems.dto.CreateWorkItemRequest;
import com.worktrack.workitems.dto.UpdateWorkItemRequest;
import com.worktrack.workitems.repository.AppUserRepository;
import com.worktrack.workitems.repository.WorkItemRepository;
import com.worktrack.workitems.service.AuthService;
import com.worktrack.workitems.service.WorkItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    static final String DEMO_USERNAME = "demo";

    @Bean
    CommandLineRunner seedWorkItems(WorkItemProperties properties,
                                    WorkItemService workItemService,
                                    WorkItemRepository workItemRepository,
                                    AuthService authService,
                                    AppUserRepository userRepository) {
        return args -> {
            if (!properties.isSeedDemoData()) {
                return;
            }

            if (!userRepository.existsByUsername(DEMO_USERNAME)) {
                authService.register(DEMO_USERNAME, "demo@worktrack.local", "demo-password");
            }

            if (workItemRepository.count() > 0) {
                return;
            }

            workItemService.create(new CreateWorkItemRequest("Set up CI pipeline", "Build and test on every push", WorkItemPriority.HIGH));
            var docs = workItemService.create(new CreateWorkItemRequest("Write API docs", null, WorkItemPriority.MEDIUM));
            var triage = workItemService.create(new CreateWorkItemRequest("Triage bug backlog", "Label and prioritise open bugs", WorkItemPriority.LOW));

            workItemService.update(docs.getId(), new UpdateWorkItemRequest(null, null, WorkItemStatus.IN_PROGRESS, null));
            workItemService.update(triage.getId(), new UpdateWorkItemRequest(null, null, WorkItemStatus.DONE, null));
            log.info("Seeded demo work items");
        };
    }
}
