package com.factory.palletizer.config;

import com.factory.palletizer.model.Material;
import com.factory.palletizer.repository.MaterialRepository;
import com.factory.palletizer.service.CounterAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner init(CounterAllocator counterAllocator,
            MaterialRepository materialRepo,
            PalletizerProperties properties) {
        return args -> {
            // Counter row must exist before anyone tries to lock it
            counterAllocator.ensureInitialized();

            if (properties.isSeedSampleMaterial() && materialRepo.count() == 0) {
                Material m = new Material();
                m.setMaterialCode("60115949");
                m.setDescription("DWP1500 LV drums");
                m.setMaxQty(20);
                m.setPrefix("SL-5959");
                m.setAllowIncomplete(true);
                m.setActive(true);
                materialRepo.save(m);
                logger.info("Seeded sample material {}", m.getMaterialCode());
            }
        };
    }
}
