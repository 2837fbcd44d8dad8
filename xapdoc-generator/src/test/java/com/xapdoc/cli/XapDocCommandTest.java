package com.xapdoc.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xapdoc.model.GenerationError;
import com.xapdoc.model.GenerationResult;
import com.xapdoc.service.XapDocGenerator;
import com.xapdoc.util.DefinitionDumper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static com.xapdoc.TestTrees.yaml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class XapDocCommandTest {

    private final XapDocGenerator generator = mock(XapDocGenerator.class);
    private final XapDocCommand command = new XapDocCommand(generator, new DefinitionDumper(new ObjectMapper()));

    @Test
    @DisplayName("successful generation exits with 0")
    void success() {
        when(generator.generate()).thenReturn(GenerationResult.success(List.of(), "xap_protocol.md"));

        command.run();

        verify(generator).generate();
        assertThat(command.getExitCode()).isEqualTo(XapDocCommand.EXIT_OK);
    }

    @Test
    @DisplayName("failed generation logs the error and the definitions, then exits with 1")
    void failure(CapturedOutput output) {
        when(generator.generate()).thenReturn(GenerationResult.failure(List.of(), GenerationError.builder()
                .kind(GenerationError.Kind.MISSING_SECTION)
                .layer("xap_0.1.0")
                .message("Documentation section '!term_definitions!' is listed in the order but not defined")
                .state(yaml("documentation: {order: ['!term_definitions!']}"))
                .build()));

        command.run();

        assertThat(command.getExitCode()).isEqualTo(XapDocCommand.EXIT_FAILED);
        assertThat(output).contains("kind=MISSING_SECTION", "layer=xap_0.1.0");
        assertThat(output).contains("Definitions at failure:");
        assertThat(output).contains("\"documentation\" : {", "\"order\" : [ \"!term_definitions!\" ]");
    }

    @Test
    @DisplayName("failure without diagnostic state still exits with 1")
    void failureWithoutState(CapturedOutput output) {
        when(generator.generate()).thenReturn(GenerationResult.failure(List.of(), GenerationError.builder()
                .kind(GenerationError.Kind.INPUT_DISCOVERY)
                .message("Definitions directory not found: data/xap")
                .build()));

        command.run();

        assertThat(command.getExitCode()).isEqualTo(XapDocCommand.EXIT_FAILED);
        assertThat(output).contains("kind=INPUT_DISCOVERY", "Definitions directory not found: data/xap");
        assertThat(output).doesNotContain("Definitions at failure");
    }
}
