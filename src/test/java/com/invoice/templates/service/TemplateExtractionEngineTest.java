package com.invoice.templates.service;

import com.invoice.templates.TestFixtures;
import com.invoice.templates.exception.EmptyDocumentException;
import com.invoice.templates.model.ExtractedRow;
import com.invoice.templates.model.ExtractionResult;
import com.invoice.templates.model.ExtractionStatus;
import com.invoice.templates.model.FieldIssue;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.TemplateStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateExtractionEngineTest {

    private final TemplateExtractionEngine engine = TestFixtures.engine();
    private final TemplateStore shipped = TestFixtures.shippedStore();

    @Test
    void extractsOrangeInvoice() {
        ExtractionResult result = engine.extract(TestFixtures.document("orange-polska.txt"), shipped("orange-polska"));

        assertThat(result.getTemplateId()).isEqualTo("orange-polska");
        assertThat(result.getTemplateName()).isEqualTo("Orange Polska");
        assertThat(result.isComplete()).isTrue();
        assertThat(result.getStatus()).isEqualTo(ExtractionStatus.COMPLETE);
        assertThat(result.getText("invoice_id")).isEqualTo("F/0012345/24");
        assertThat(result.getDate("issue_date")).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(result.get("supplier_tax_id")).isEqualTo("5260250995");
        assertThat(result.get("customer_number")).isEqualTo(100200300L);
        assertThat(result.getText("period")).isEqualTo("01.03.2024 - 31.03.2024");
        assertThat(result.get("bank_account")).isEqualTo("PL61 1090 1014 0000 0712 1981 2874");
        assertThat(result.getAmount("total_gross")).isEqualTo(new BigDecimal("148.22"));
        assertThat(result.getCoverage()).isEqualTo(100.0);

        assertThat(result.getLineItems()).hasSize(2);
        ExtractedRow first = result.getLineItems().get(0);
        assertThat(first)
                .containsEntry("description", "Abonament Orange Love")
                .containsEntry("net", "100,00")
                .containsEntry("vat_rate", "23%")
                .containsEntry("gross", "123,00");
    }

    @Test
    void extractsGenericPolishInvoice() {
        ExtractionResult result = engine.extract(TestFixtures.document("generic-pl.txt"), shipped("generic-pl"));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getText("invoice_id")).isEqualTo("FV/2024/03/117");
        assertThat(result.getDate("issue_date")).isEqualTo(LocalDate.of(2024, 3, 20));
        assertThat(result.get("supplier_tax_id")).isEqualTo("1234563218");
        assertThat(result.get("buyer_tax_id")).isEqualTo("7740001454");
        assertThat(result.get("bank_account")).isEqualTo("PL61 1090 1014 0000 0712 1981 2874");
        assertThat(result.getAmount("total_net")).isEqualTo(new BigDecimal("1000.00"));
        // "Do zapłaty" is absent, the second pattern supplies the total
        assertThat(result.getAmount("total_gross")).isEqualTo(new BigDecimal("1230.00"));

        assertThat(result.getDate("due_date")).isEqualTo(LocalDate.of(2024, 4, 3));
        assertThat(result.getAmount("total_vat")).isEqualTo(new BigDecimal("230.00"));
        assertThat(result.getDerivedFields()).containsExactly("due_date", "total_vat");
        assertThat(result.getIssues()).isEmpty();
    }

    @Test
    void printedValueTakesPrecedenceOverFallback() {
        String text = TestFixtures.document("generic-pl.txt")
                .replace("Razem brutto", "Termin płatności: 10.04.2024\nRazem brutto");

        ExtractionResult result = engine.extract(text, shipped("generic-pl"));

        assertThat(result.getDate("due_date")).isEqualTo(LocalDate.of(2024, 4, 10));
        assertThat(result.getDerivedFields()).containsExactly("total_vat");
    }

    @Test
    void fallbacksDeriveFromOtherFields() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  issue_date: { patterns: ['Date (\\S+)'], type: date }
                  sale_date: { patterns: ['Sold (\\S+)'], type: date, fallback: use_issue_date }
                  total_net: { patterns: ['Net (\\S+)'], type: amount, fallback: 'calculate_from_gross:23' }
                  reduced_net: { patterns: ['Reduced (\\S+)'], type: amount, fallback: 'calculate_from_gross:5' }
                  total_vat: { patterns: ['VAT (\\S+)'], type: amount, fallback: calculate_difference }
                  total_gross: { patterns: ['Gross (\\S+)'], type: amount, total: true }
                """);

        ExtractionResult result = engine.extract("Date 2024-03-15\nGross 123,00", template);

        assertThat(result.getDate("sale_date")).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(result.getAmount("total_net")).isEqualTo(new BigDecimal("100.00"));
        assertThat(result.getAmount("reduced_net")).isEqualTo(new BigDecimal("117.14"));
        // total_net is declared first, so its derived value is available here
        assertThat(result.getAmount("total_vat")).isEqualTo(new BigDecimal("23.00"));
        assertThat(result.getDerivedFields()).containsExactly("sale_date", "total_net", "reduced_net", "total_vat");
        assertThat(result.getCoverage()).isEqualTo(100.0);
    }

    @Test
    void fallbackWithoutInputsLeavesRequiredFieldMissing() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  issue_date: { patterns: ['Date (\\S+)'], type: date }
                  due_date: { patterns: ['Due (\\S+)'], type: date, fallback: 'add_days:14', required: true }
                """);

        ExtractionResult result = engine.extract("no dates here", template);

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getIssues()).containsExactly(FieldIssue.missing("due_date"));
        assertThat(result.getDerivedFields()).isEmpty();
    }

    @Test
    void contextKeywordsNarrowTheSearch() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  buyer_tax_id:
                    patterns: ['NIP:? ([\\d-]+)']
                    context_keywords: [Nabywca]
                    context_range: 80
                  seller_tax_id:
                    patterns: ['NIP:? ([\\d-]+)']
                    context_keywords: [Kontrahent]
                """);
        String text = "Sprzedawca: Alfa Sp. z o.o.\nNIP: 123-456-32-18\n"
                + "x".repeat(60) + "\nNABYWCA: Beta S.A.\nNIP: 774-000-14-54";

        ExtractionResult result = engine.extract(text, template);

        assertThat(result.getText("buyer_tax_id")).isEqualTo("774-000-14-54");
        // no "Kontrahent" in the text, so the whole text is searched
        assertThat(result.getText("seller_tax_id")).isEqualTo("123-456-32-18");
    }

    @Test
    void inconsistentTotalsAreReportedWithoutBreakingCompleteness() {
        String text = TestFixtures.document("generic-pl.txt")
                .replace("Razem brutto", "Razem VAT: 200,00\nRazem brutto");

        ExtractionResult result = engine.extract(text, shipped("generic-pl"));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getAmount("total_vat")).isEqualTo(new BigDecimal("200.00"));
        assertThat(result.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getField()).isEqualTo("total_gross");
            assertThat(issue.getKind()).isEqualTo(FieldIssue.Kind.INCONSISTENT);
            assertThat(issue.getReason()).isEqualTo("net 1000.00 + vat 200.00 = 1200.00 but gross is 1230.00");
        });
    }

    @Test
    void extractsGermanAndRomanianInvoices() {
        ExtractionResult de = engine.extract(TestFixtures.document("generic-de.txt"), shipped("generic-de"));
        ExtractionResult ro = engine.extract(TestFixtures.document("generic-ro.txt"), shipped("generic-ro"));

        assertThat(de.isComplete()).isTrue();
        assertThat(de.getText("invoice_id")).isEqualTo("RE-2024-0042");
        assertThat(de.getAmount("total_gross")).isEqualTo(new BigDecimal("1190.00"));
        assertThat(de.get("bank_account")).isEqualTo("DE89 3704 0044 0532 0130 00");

        assertThat(ro.isComplete()).isTrue();
        assertThat(ro.getText("invoice_id")).isEqualTo("BV-1024");
        assertThat(ro.getDate("issue_date")).isEqualTo(LocalDate.of(2024, 4, 12));
        assertThat(ro.get("supplier_tax_id")).isEqualTo("18547290");
        assertThat(ro.getAmount("total_gross")).isEqualTo(new BigDecimal("2380.00"));
    }

    @Test
    void missingRequiredFieldLeavesOtherFieldsPopulated() {
        String text = TestFixtures.document("generic-pl.txt").replace("Data wystawienia: 2024-03-20", "");

        ExtractionResult result = engine.extract(text, shipped("generic-pl"));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getStatus()).isEqualTo(ExtractionStatus.PARTIAL);
        assertThat(result.getFields()).doesNotContainKey("issue_date");
        assertThat(result.getIssues()).containsExactly(FieldIssue.missing("issue_date"));
        assertThat(result.getText("invoice_id")).isEqualTo("FV/2024/03/117");
        assertThat(result.getAmount("total_gross")).isEqualTo(new BigDecimal("1230.00"));
        assertThat(result.getCoverage()).isLessThan(100.0);
    }

    @Test
    void firstPatternWithACaptureWinsEvenIfItsValueIsInvalid() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  issue_date:
                    patterns: ['Issued (\\S+)', 'Date (\\S+)']
                    type: date
                    required: true
                """);

        ExtractionResult result = engine.extract("Issued 31.02.2024\nDate 01.03.2024", template);

        assertThat(result.getFields()).isEmpty();
        assertThat(result.isComplete()).isFalse();
        assertThat(result.getIssues()).singleElement()
                .satisfies(issue -> {
                    assertThat(issue.getKind()).isEqualTo(FieldIssue.Kind.INVALID);
                    assertThat(issue.getReason()).contains("not a valid date");
                });
    }

    @Test
    void invalidOptionalFieldIsReportedButKeepsResultComplete() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  invoice_id: { patterns: ['Invoice (\\S+)'], required: true }
                  supplier_tax_id: { patterns: ['NIP (\\S+)'], validator: nip }
                """);

        ExtractionResult result = engine.extract("Invoice A-1\nNIP 5260250959", template);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getFields()).containsOnlyKeys("invoice_id");
        assertThat(result.getIssues()).extracting(FieldIssue::getField).containsExactly("supplier_tax_id");
    }

    @Test
    void patternsAlsoSeeWhitespaceNormalizedText() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  seller: { patterns: ['Seller: (\\w+ \\w+)'] }
                """);

        ExtractionResult result = engine.extract("Seller:\n  Acme\n   Trading", template);

        assertThat(result.getText("seller")).isEqualTo("Acme Trading");
    }

    @Test
    void patternWithoutGroupsUsesWholeMatch() {
        DocumentTemplate template = TestFixtures.template("t", """
                fields:
                  currency: { patterns: ['\\b(?:PLN|EUR)\\b'] }
                """);

        assertThat(engine.extract("Kwota 10,00 EUR", template).getText("currency")).isEqualTo("EUR");
    }

    @Test
    void sameInputGivesEqualResult() {
        String text = TestFixtures.document("orange-polska.txt");
        DocumentTemplate template = shipped("orange-polska");

        assertThat(engine.extract(text, template)).isEqualTo(engine.extract(text, template));
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> engine.extract(" \n\t", shipped("generic-pl")))
                .isInstanceOf(EmptyDocumentException.class);
    }

    private DocumentTemplate shipped(String id) {
        return shipped.findById(id).orElseThrow();
    }
}
