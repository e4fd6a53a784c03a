package com.photomosaic;

import com.photomosaic.model.MosaicResult;
import com.photomosaic.model.MosaicStats;
import com.photomosaic.service.MosaicService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.awt.image.BufferedImage;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class MosaicRunnerTest {

    private MosaicService mosaicService;
    private MosaicRunner runner;

    @BeforeEach
    void setUp() {
        mosaicService = mock(MosaicService.class);
        runner = new MosaicRunner(mosaicService);
    }

    @Test
    void runsMosaicOnce() throws Exception {
        BufferedImage canvas = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
        when(mosaicService.createMosaic()).thenReturn(new MosaicResult(canvas, new MosaicStats(1, 1, 0, 0)));

        assertThatCode(() -> runner.run()).doesNotThrowAnyException();

        verify(mosaicService).createMosaic();
    }

    @Test
    void failureIsPropagatedToStopTheApplication() throws Exception {
        when(mosaicService.createMosaic()).thenThrow(new IOException("Image not found: photos/motive.jpg"));

        assertThatThrownBy(() -> runner.run())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("motive.jpg");
    }

    @Test
    void failureIsLoggedWithoutStackTrace(CapturedOutput output) throws Exception {
        when(mosaicService.createMosaic()).thenThrow(new IOException("Image not found: photos/motive.jpg"));

        assertThatThrownBy(() -> runner.run()).isInstanceOf(IOException.class);

        // Spring Boot prints the stack trace when the runner's exception stops the application
        assertThat(output.getAll()).contains("Mosaic run failed: Image not found: photos/motive.jpg");
        assertThat(output.getAll()).doesNotContain("java.io.IOException");
    }
}
