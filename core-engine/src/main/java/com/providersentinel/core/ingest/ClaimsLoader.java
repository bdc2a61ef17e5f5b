package com.providersentinel.core.ingest;

import com.providersentinel.core.model.Claim;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Loads billed-service claims.
 *
 * <p>
 * Expected header columns: {@value #BILLING_NPI}, {@value #SERVICING_NPI}
 * (optional), {@value #SERVICE_MONTH}, {@value #HCPCS_CODE},
 * {@value #PAID_AMOUNT}, {@value #BENEFICIARY_ID}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClaimsLoader {

    public static final String BILLING_NPI = "billing_provider_npi";
    public static final String SERVICING_NPI = "servicing_provider_npi";
    public static final String SERVICE_MONTH = "service_month";
    public static final String HCPCS_CODE = "hcpcs_code";
    public static final String PAID_AMOUNT = "paid_amount";
    public static final String BENEFICIARY_ID = "beneficiary_id";

    private ClaimsLoader() {
        // utility class
    }

    /**
     * @param file claims CSV
     * @return loaded claims
     * @throws DatasetLoadException if the file is missing or unreadable
     */
    public static LoadResult<Claim> load(Path file) {
        return CsvSource.read(file, ClaimsLoader::toClaim);
    }

    static Claim toClaim(Map<String, String> row) {
        String code = CsvSource.optional(row, HCPCS_CODE);
        return Claim.builder()
                .billingProviderId(CsvSource.required(row, BILLING_NPI))
                .servicingProviderId(CsvSource.optional(row, SERVICING_NPI))
                .serviceMonth(SourceDates.parseServiceMonth(CsvSource.required(row, SERVICE_MONTH)))
                .paidAmount(CsvSource.requiredAmount(row, PAID_AMOUNT))
                .procedureCode(code != null ? code.toUpperCase(Locale.ROOT) : null)
                .beneficiaryId(CsvSource.optional(row, BENEFICIARY_ID))
                .build();
    }
}
