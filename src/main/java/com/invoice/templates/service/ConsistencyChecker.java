package com.invoice.templates.service;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.model.ExtractedRow;
import com.invoice.templates.model.ExtractionResult;
import com.invoice.templates.model.FieldIssue;
import com.invoice.templates.template.AmountFormat;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.FieldRule;
import com.invoice.templates.template.IssuerSignature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Cross-field checks on a finished extraction. Findings are recorded as
 * {@link FieldIssue.Kind#INCONSISTENT} issues; fields stay as extracted.
 */
@Component
@Slf4j
public class ConsistencyChecker {

    private final ExtractionProperties.Invoice invoice;

    public ConsistencyChecker(ExtractionProperties properties) {
        this.invoice = properties.getInvoice();
    }

    public void check(ExtractionResult result, DocumentTemplate template) {
        checkTotals(result);
        checkParties(result);
        for (String table : template.getTables().keySet()) {
            checkLineItems(result, template, table);
        }
    }

    // net + vat must equal gross within the tolerance
    private void checkTotals(ExtractionResult result) {
        BigDecimal net = result.getAmount(invoice.getNetField());
        BigDecimal vat = result.getAmount(invoice.getVatField());
        BigDecimal gross = result.getAmount(invoice.getGrossField());
        if (net == null || vat == null || gross == null) {
            return;
        }

        BigDecimal calculated = net.add(vat);
        if (calculated.subtract(gross).abs().compareTo(invoice.getTotalsTolerance()) > 0) {
            report(result, invoice.getGrossField(), String.format(
                    "net %s + vat %s = %s but gross is %s",
                    net.toPlainString(), vat.toPlainString(), calculated.toPlainString(), gross.toPlainString()));
        }
    }

    private void checkParties(ExtractionResult result) {
        String supplier = result.getText(invoice.getSupplierTaxIdField());
        String buyer = result.getText(invoice.getBuyerTaxIdField());
        if (supplier == null || buyer == null) {
            return;
        }
        if (IssuerSignature.normalizeFiscalId(supplier).equals(IssuerSignature.normalizeFiscalId(buyer))) {
            report(result, invoice.getBuyerTaxIdField(), "buyer has the supplier's tax id " + supplier);
        }
    }

    private void checkLineItems(ExtractionResult result, DocumentTemplate template, String table) {
        List<ExtractedRow> rows = result.getTables().get(table);
        BigDecimal gross = result.getAmount(invoice.getGrossField());
        if (rows == null || rows.isEmpty() || gross == null) {
            return;
        }

        AmountFormat format = amountFormat(template);
        BigDecimal sum = BigDecimal.ZERO;
        int counted = 0;
        for (ExtractedRow row : rows) {
            Optional<BigDecimal> amount = format.parse(row.getString(invoice.getLineTotalColumn()));
            if (amount.isPresent()) {
                sum = sum.add(amount.get());
                counted++;
            }
        }
        if (counted == 0) {
            log.debug("Table '{}' has no '{}' amounts to sum", table, invoice.getLineTotalColumn());
            return;
        }

        if (sum.subtract(gross).abs().compareTo(invoice.getLineItemsTolerance()) > 0) {
            report(result, table, String.format("line items sum to %s but gross is %s",
                    sum.toPlainString(), gross.toPlainString()));
        }
    }

    // line cells use the separator convention of the gross field
    private AmountFormat amountFormat(DocumentTemplate template) {
        FieldRule gross = template.getFields().get(invoice.getGrossField());
        String hint = gross == null ? null : gross.getFormatHint();
        return AmountFormat.fromHint(hint).orElse(AmountFormat.COMMA);
    }

    private static void report(ExtractionResult result, String field, String reason) {
        log.warn("Inconsistent '{}': {}", field, reason);
        result.getIssues().add(FieldIssue.inconsistent(field, reason));
    }
}
