package com.flagship.finance_ledger.tax;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * GST state codes, as used in the first two characters of a GSTIN.
 */
public enum IndianState {
    JAMMU_AND_KASHMIR("01", "Jammu and Kashmir"),
    HIMACHAL_PRADESH("02", "Himachal Pradesh"),
    PUNJAB("03", "Punjab"),
    CHANDIGARH("04", "Chandigarh"),
    UTTARAKHAND("05", "Uttarakhand"),
    HARYANA("06", "Haryana"),
    DELHI("07", "Delhi"),
    RAJASTHAN("08", "Rajasthan"),
    UTTAR_PRADESH("09", "Uttar Pradesh"),
    BIHAR("10", "Bihar"),
    SIKKIM("11", "Sikkim"),
    ARUNACHAL_PRADESH("12", "Arunachal Pradesh"),
    NAGALAND("13", "Nagaland"),
    MANIPUR("14", "Manipur"),
    MIZORAM("15", "Mizoram"),
    TRIPURA("16", "Tripura"),
    MEGHALAYA("17", "Meghalaya"),
    ASSAM("18", "Assam"),
    WEST_BENGAL("19", "West Bengal"),
    JHARKHAND("20", "Jharkhand"),
    ODISHA("21", "Odisha"),
    CHHATTISGARH("22", "Chhattisgarh"),
    MADHYA_PRADESH("23", "Madhya Pradesh"),
    GUJARAT("24", "Gujarat"),
    DAMAN_AND_DIU("25", "Daman and Diu"),
    DADRA_AND_NAGAR_HAVELI("26", "Dadra and Nagar Haveli"),
    MAHARASHTRA("27", "Maharashtra"),
    ANDHRA_PRADESH_OLD("28", "Andhra Pradesh"),
    KARNATAKA("29", "Karnataka"),
    GOA("30", "Goa"),
    LAKSHADWEEP("31", "Lakshadweep"),
    KERALA("32", "Kerala"),
    TAMIL_NADU("33", "Tamil Nadu"),
    PUDUCHERRY("34", "Puducherry"),
    ANDAMAN_AND_NICOBAR("35", "Andaman and Nicobar Islands"),
    TELANGANA("36", "Telangana"),
    ANDHRA_PRADESH("37", "Andhra Pradesh (New)"),
    LADAKH("38", "Ladakh"),
    OTHER_TERRITORY("97", "Other Territory");

    private static final Map<String, IndianState> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(IndianState::getCode, Function.identity()));

    private final String code;
    private final String displayName;

    IndianState(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<IndianState> fromCode(String code) {
        return Optional.ofNullable(code).map(BY_CODE::get);
    }

    /**
     * Supply between two different states is inter-state and attracts IGST.
     */
    public static boolean isInterState(String supplierStateCode, String placeOfSupplyCode) {
        if (supplierStateCode == null || placeOfSupplyCode == null) {
            return false;
        }
        return !supplierStateCode.equals(placeOfSupplyCode);
    }
}
