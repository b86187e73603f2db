package com.williamcallahan.research_engine.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for TextUtils title keys, snippet cleaning and domain extraction.
 */
public class TextUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "'  Deep Learning: A Review!  ', deep learning a review",
        "'BERT: Pre-training of Deep Bidirectional Transformers', bert pretraining of deep bidirectional transformers",
        "'Attention Is All You Need', attention is all you need",
        "'GPT-4 Technical Report (2023)', gpt4 technical report 2023"
    })
    void normalizeTitleKey_lowercasesAndStripsPunctuation(String input, String expected) {
        assertEquals(expected, TextUtils.normalizeTitleKey(input));
    }

    @Test
    void normalizeTitleKey_nullBecomesEmpty() {
        assertEquals("", TextUtils.normalizeTitleKey(null));
        assertEquals("", TextUtils.normalizeTitleKey("!!!"));
    }

    @Test
    void cleanSnippet_removesMarkdownAndHtml() {
        String raw = "Check ![logo](http://x/y.png) the [docs](http://d.example) <b>now</b>\n\n  please";
        assertEquals("Check the docs now please", TextUtils.cleanSnippet(raw));
    }

    @Test
    void cleanSnippet_truncatesAtWordBoundary() {
        assertEquals("alpha beta...", TextUtils.cleanSnippet("alpha beta gamma", 12));
    }

    @Test
    void cleanSnippet_keepsShortTextUntouched() {
        assertEquals("short text", TextUtils.cleanSnippet("short text", 150));
        assertEquals("", TextUtils.cleanSnippet(null));
        assertEquals("", TextUtils.cleanSnippet(""));
    }

    @Test
    void domainOf_returnsHost() {
        assertEquals("www.kaggle.com", TextUtils.domainOf("https://www.kaggle.com/datasets/covid"));
        assertEquals("", TextUtils.domainOf("kaggle"));
        assertEquals("", TextUtils.domainOf(null));
    }
}
