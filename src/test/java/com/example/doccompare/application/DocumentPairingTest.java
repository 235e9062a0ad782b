package com.example.doccompare.application;

import com.example.doccompare.domain.DocumentInput;
import com.example.doccompare.domain.DocumentPair;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentPairingTest {

    private final DocumentPairing pairing = new DocumentPairing();

    @Test
    void pairsDocumentsByStemInKeyOrder() {
        DocumentPairing.PairingResult result =
                pairing.pair(
                        List.of(document("zeta.docx"), document("alpha.docx")),
                        List.of(document("alpha.html"), document("zeta.htm")));

        assertThat(result.pairs()).extracting(DocumentPair::key).containsExactly("alpha", "zeta");
        assertThat(result.pairs().get(0).left().filename()).isEqualTo("alpha.docx");
        assertThat(result.pairs().get(0).right().filename()).isEqualTo("alpha.html");
        assertThat(result.unpairedLeft()).isEmpty();
        assertThat(result.unpairedRight()).isEmpty();
    }

    @Test
    void reportsUploadsWithoutCounterpart() {
        DocumentPairing.PairingResult result =
                pairing.pair(
                        List.of(document("report.docx"), document("annex.docx")),
                        List.of(document("report.html"), document("summary.html")));

        assertThat(result.pairs()).extracting(DocumentPair::key).containsExactly("report");
        assertThat(result.unpairedLeft()).containsExactly("annex.docx");
        assertThat(result.unpairedRight()).containsExactly("summary.html");
    }

    @Test
    void laterUploadWithSameStemWins() {
        DocumentPairing.PairingResult result =
                pairing.pair(
                        List.of(document("report.txt"), document("report.docx")),
                        List.of(document("report.html")));

        assertThat(result.pairs()).hasSize(1);
        assertThat(result.pairs().get(0).left().filename()).isEqualTo("report.docx");
    }

    private static DocumentInput document(String filename) {
        return new DocumentInput(filename, () -> new ByteArrayInputStream(new byte[0]));
    }
}
