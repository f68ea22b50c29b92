package com.ctis.payments.provider;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.exception.UnmappedStatusCodeException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Provider status vocabulary to internal status, for every gateway type. Codes missing
 * here are errors; nothing falls back to a default state.
 */
public final class ProviderStatusCodes {

    private static final Map<GatewayType, Map<String, TransactionStatus>> TABLE;

    static {
        Map<GatewayType, Map<String, TransactionStatus>> table = new EnumMap<>(GatewayType.class);

        Map<String, TransactionStatus> orange = new LinkedHashMap<>();
        orange.put("INITIATED", TransactionStatus.INITIATED);
        orange.put("PENDING", TransactionStatus.PENDING);
        orange.put("PROCESSING", TransactionStatus.PROCESSING);
        orange.put("SUCCESS", TransactionStatus.COMPLETED);
        orange.put("COMPLETED", TransactionStatus.COMPLETED);
        orange.put("FAILED", TransactionStatus.FAILED);
        orange.put("CANCELLED", TransactionStatus.CANCELLED);
        orange.put("EXPIRED", TransactionStatus.EXPIRED);
        table.put(GatewayType.ORANGE_MONEY, orange);

        Map<String, TransactionStatus> africell = new LinkedHashMap<>();
        africell.put("INITIATED", TransactionStatus.INITIATED);
        africell.put("PENDING", TransactionStatus.PENDING);
        africell.put("PROCESSING", TransactionStatus.PROCESSING);
        africell.put("SUCCESS", TransactionStatus.COMPLETED);
        africell.put("COMPLETED", TransactionStatus.COMPLETED);
        africell.put("FAILED", TransactionStatus.FAILED);
        africell.put("CANCELLED", TransactionStatus.CANCELLED);
        africell.put("EXPIRED", TransactionStatus.EXPIRED);
        table.put(GatewayType.AFRICELL_MONEY, africell);

        // pain.002 TxSts codes plus the plain-text aliases the switch also sends
        Map<String, TransactionStatus> salone = new LinkedHashMap<>();
        salone.put("PDNG", TransactionStatus.PENDING);
        salone.put("PENDING", TransactionStatus.PENDING);
        salone.put("ACSC", TransactionStatus.COMPLETED);
        salone.put("COMPLETED", TransactionStatus.COMPLETED);
        salone.put("RJCT", TransactionStatus.FAILED);
        salone.put("FAILED", TransactionStatus.FAILED);
        table.put(GatewayType.SALONE_SWITCH, salone);

        Map<String, TransactionStatus> generic = new LinkedHashMap<>();
        generic.put("PENDING", TransactionStatus.PENDING);
        generic.put("PROCESSING", TransactionStatus.PROCESSING);
        generic.put("COMPLETED", TransactionStatus.COMPLETED);
        generic.put("FAILED", TransactionStatus.FAILED);
        generic.put("CANCELLED", TransactionStatus.CANCELLED);
        table.put(GatewayType.GENERIC_GATEWAY, generic);

        table.replaceAll((type, codes) -> Collections.unmodifiableMap(codes));
        TABLE = Collections.unmodifiableMap(table);
    }

    private ProviderStatusCodes() {
    }

    /**
     * @throws UnmappedStatusCodeException when the code is blank or not in the table
     */
    public static TransactionStatus map(GatewayType gatewayType, String code) {
        if (code == null || code.isBlank()) {
            throw new UnmappedStatusCodeException(gatewayType, code);
        }
        TransactionStatus status = TABLE.get(gatewayType).get(code.trim().toUpperCase(Locale.ROOT));
        if (status == null) {
            throw new UnmappedStatusCodeException(gatewayType, code);
        }
        return status;
    }

    public static Map<String, TransactionStatus> codesFor(GatewayType gatewayType) {
        return TABLE.get(gatewayType);
    }
}
