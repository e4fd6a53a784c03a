package com.photomosaic;

import com.photomosaic.model.MosaicResult;
import com.photomosaic.service.MosaicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "photomosaic.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MosaicRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MosaicRunner.class);

    private final MosaicService mosaicService;

    public MosaicRunner(MosaicService mosaicService) {
        this.mosaicService = mosaicService;
    }

    @Override
    public void run(String... args) throws Exception {
        try {
            MosaicResult result = mosaicService.createMosaic();
            log.info("Mosaic finished: {}x{} px", result.canvas().getWidth(), result.canvas().getHeight());
        } catch (Exception e) {
            log.error("Mosaic run failed: {}", e.getMessage());
            throw e;
        }
    }
}
