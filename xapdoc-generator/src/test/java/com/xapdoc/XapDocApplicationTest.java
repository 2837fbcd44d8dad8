package com.xapdoc;

import com.xapdoc.cli.XapDocCommand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class XapDocApplicationTest {

    @TempDir
    static Path outputDir;

    @Autowired
    private XapDocCommand command;

    @DynamicPropertySource
    static void xapdocProperties(DynamicPropertyRegistry registry) {
        registry.add("xapdoc.definitions-dir", XapDocApplicationTest::fixtureDir);
        registry.add("xapdoc.output-dir", () -> outputDir.toString());
        registry.add("xapdoc.latest-definitions-file", () -> "xap_latest.json");
    }

    private static String fixtureDir() {
        try {
            return Paths.get(XapDocApplicationTest.class.getResource("/definitions").toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    @DisplayName("startup generates every layer document and the index")
    void generatesDocumentation() throws IOException {
        assertThat(command.getExitCode()).isZero();
        assertThat(outputDir.resolve("xap_0.0.1.md")).exists();
        assertThat(outputDir.resolve("xap_0.1.0.md")).exists();
        assertThat(outputDir.resolve("xap_0.2.0.md")).exists();
        assertThat(outputDir.resolve("xap_latest.json")).exists();

        assertThat(Files.readString(outputDir.resolve("xap_protocol.md"))).isEqualTo("""
                # XAP Protocol Reference

                * [XAP Version 0.2.0](xap_0.2.0.md)
                * [XAP Version 0.1.0](xap_0.1.0.md)
                * [XAP Version 0.0.1](xap_0.0.1.md)
                """);
    }

    @Test
    @DisplayName("each document reflects the definitions merged up to its version")
    void documentsAreCumulative() throws IOException {
        String first = Files.readString(outputDir.resolve("xap_0.0.1.md"));
        String second = Files.readString(outputDir.resolve("xap_0.1.0.md"));
        String third = Files.readString(outputDir.resolve("xap_0.2.0.md"));

        assertThat(first).contains("# XAP Version 0.0.1").doesNotContain("Bit 7").doesNotContain("_token_");
        assertThat(second).contains("# XAP Version 0.1.0").contains("| _token_ |").contains("| _u8_ |");
        assertThat(second).contains("| UNLOCKED | - | - | - | - | - | SECURE_FAILURE | SUCCESS |");
        assertThat(third).contains("| UNLOCKED | UNLOCKING | - | - | - | - | SECURE_FAILURE | SUCCESS |");
        assertThat(third).contains("| _Payload_ | Any data received in a request after the route. |");
        assertThat(third.indexOf("## Requests and Responses")).isLessThan(third.indexOf("### Response flags"));
    }
}
