package com.todayatsg.backend.startup;

import com.todayatsg.backend.event.CategoryRepository;
import com.todayatsg.backend.model.entity.Category;
import com.todayatsg.backend.model.enums.EventCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Makes sure every fixed event category has its row
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategorySeeder implements ApplicationRunner {

    private final CategoryRepository categoryRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int created = 0;
        for (EventCategory category : EventCategory.values()) {
            if (categoryRepository.existsBySlug(category.getSlug())) continue;
            categoryRepository.save(Category.builder()
                    .name(category.getDisplayName())
                    .slug(category.getSlug())
                    .sortOrder(category.ordinal())
                    .build());
            created++;
        }
        if (created > 0) {
            log.info("Seeded {} event categories", created);
        }
    }
}
