package co.fanki.componentflow.analysis.domain.imports;

import co.fanki.componentflow.analysis.domain.ast.SharedSyntaxEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ImportExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImportExtractorTest {

    private final ImportExtractor extractor = new ImportExtractor();

    @Test
    void whenExtracting_givenAllBindingForms_shouldCreateOneRecordEach() {
        final List<ImportRecord> records = extract("""
                import React, { useState } from 'react';
                import { Card as Tile } from '@/components/Card';
                import * as Icons from 'react-icons';
                """);

        assertEquals(4, records.size());

        final ImportRecord react = records.get(0);
        assertEquals("React", react.localName());
        assertTrue(react.isDefault());

        final ImportRecord tile = records.get(2);
        assertEquals("Tile", tile.localName());
        assertEquals("Card", tile.importedName());
        assertEquals("@/components/Card", tile.modulePath());

        final ImportRecord icons = records.get(3);
        assertTrue(icons.isNamespace());
        assertTrue(icons.provides("Icons.Home"));
    }

    @Test
    void whenExtracting_givenTypeOnlyImports_shouldSkipThem() {
        final List<ImportRecord> records = extract("""
                import type { Props } from './types';
                import { type Theme, Button } from './ui';
                """);

        assertEquals(1, records.size());
        assertEquals("Button", records.get(0).localName());
    }

    @Test
    void whenExtracting_givenSideEffectImport_shouldCreateNoRecord() {
        assertTrue(extract("import './styles.css';").isEmpty());
    }

    @Test
    void whenMatching_givenUnrelatedName_shouldNotProvide() {
        final ImportRecord record = new ImportRecord("Button", "default",
                "./Button", true, false);

        assertFalse(record.provides("ButtonGroup"));
        assertFalse(record.provides(null));
    }

    private List<ImportRecord> extract(final String source) {
        return extractor.extract(SharedSyntaxEngine.parse(source));
    }
}
