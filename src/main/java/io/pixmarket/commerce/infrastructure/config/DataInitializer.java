package io.pixmarket.commerce.infrastructure.config;

import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 로컬 개발용 카탈로그 데이터 (이벤트 2개, 사진 10장)
 */
@Slf4j
@Component
@Profile("local")
@RequiredArgsConstructor
public class DataInitializer implements ApplicationRunner {

    private final PhotoRepository photoRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (photoRepository.count() > 0) {
            log.info("Catalog already loaded. Skipping data initialization.");
            return;
        }

        for (int i = 1; i <= 6; i++) {
            photoRepository.save(Photo.create(1L, String.format("marathon_%03d.jpg", i), 499L));
        }
        for (int i = 1; i <= 4; i++) {
            photoRepository.save(Photo.create(2L, String.format("wedding_%03d.jpg", i), 1299L));
        }

        log.info("Initial catalog loaded: {} photos", photoRepository.count());
    }
}
