package com.taxdoc.core.sequence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JurisdictionExtractorTest {

    @Test
    void findsPrefectureAndWard() {
        ExtractedJurisdiction result = JurisdictionExtractor.extract("東京都 千代田区長 殿");

        assertEquals(List.of("東京都"), result.prefectures());
        assertEquals(List.of("千代田区"), result.municipalities());
    }

    @Test
    void stripsPrefectureGluedToMunicipality() {
        assertEquals(List.of("蒲郡市"), JurisdictionExtractor.extract("愛知県蒲郡市役所").municipalities());
        assertEquals(List.of("福岡市"), JurisdictionExtractor.extract("福岡県福岡市").municipalities());
    }

    @Test
    void taxTermsAreNotPlaceNames() {
        ExtractedJurisdiction result = JurisdictionExtractor.extract("法人市町村民税\n法人市民税");

        assertTrue(result.municipalities().isEmpty(), result.toString());
        assertTrue(result.isEmpty());
    }

    @Test
    void prefecturesFollowTextOrder() {
        assertEquals(List.of("福岡県", "東京都"), JurisdictionExtractor.extract("福岡県 本店 東京都 支店").prefectures());
    }

    @Test
    void normalizeNameDropsAdministrativeSuffix() {
        assertEquals("愛知", JurisdictionExtractor.normalizeName("愛知県"));
        assertEquals("蒲郡", JurisdictionExtractor.normalizeName(" 蒲郡市 "));
        assertEquals("北海道", JurisdictionExtractor.normalizeName("北海道"));
        assertEquals("", JurisdictionExtractor.normalizeName(null));
    }

    @Test
    void blankTextYieldsNothing() {
        assertTrue(JurisdictionExtractor.extract("  ").isEmpty());
        assertTrue(JurisdictionExtractor.extract(null).isEmpty());
    }
}
