package com.vidnyan.playscan.domain.template;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateReferenceExtractorTest {

    private final TemplateReferenceExtractor extractor = new TemplateReferenceExtractor();

    @Test
    void extractsRootNamesButNotAttributesOrFilters() {
        TemplateReferences refs = extractor.extract("{{ foo.bar | default(baz) }}");

        assertEquals(List.of("foo", "baz"), List.copyOf(refs.variables()));
        assertFalse(refs.dynamic());
        assertFalse(refs.isMalformed());
    }

    @Test
    void ignoresGlobalsAndQuotedText() {
        TemplateReferences refs = extractor.extract("{{ item }}-{{ lookup('env', 'HOME') }}");

        assertEquals(Set.of("item"), refs.variables());
    }

    @Test
    void loopTargetsAreBoundInsideTheLoop() {
        TemplateReferences refs = extractor.extract("{% for host in backends %}{{ host }}:{{ port }}{% endfor %}");

        assertEquals(List.of("backends", "port"), List.copyOf(refs.variables()));
    }

    @Test
    void rawBlocksAreNotScanned() {
        TemplateReferences refs = extractor.extract("{% raw %}{{ not_a_var }}{% endraw %}");

        assertTrue(refs.isEmpty());
        assertFalse(refs.isMalformed());
    }

    @Test
    void bareExpressionSkipsTestNamesAndKeywords() {
        TemplateReferences refs = extractor.extractExpression("result is defined and not skip_checks");

        assertEquals(List.of("result", "skip_checks"), List.copyOf(refs.variables()));
    }

    @Test
    void keywordArgumentNamesAreNotReferences() {
        TemplateReferences refs = extractor.extract("{{ users | selectattr('active') | map(attribute=field) }}");

        assertEquals(List.of("users", "field"), List.copyOf(refs.variables()));
    }

    @Test
    void unterminatedExpressionIsMalformed() {
        TemplateReferences refs = extractor.extract("{{ foo ");

        assertTrue(refs.isMalformed());
        assertTrue(refs.variables().isEmpty());
        assertTrue(refs.parseError().isPresent());
    }

    @Test
    void unbalancedParenthesesAreMalformed() {
        assertTrue(extractor.extract("{{ (a + b }}").isMalformed());
    }

    @Test
    void varsLookupIsDynamic() {
        TemplateReferences refs = extractor.extract("{{ vars['db_' + suffix] }}");

        assertTrue(refs.dynamic());
        assertTrue(refs.variables().contains("suffix"));
    }

    @Test
    void plainTextHasNoReferences() {
        assertTrue(extractor.extract("just text").isEmpty());
        assertFalse(TemplateReferenceExtractor.isTemplated("just text"));
        assertTrue(TemplateReferenceExtractor.isTemplated("a {{ b }}"));
    }
}
