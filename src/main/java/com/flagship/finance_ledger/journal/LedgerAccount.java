package com.flagship.finance_ledger.journal;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * System accounts every organization's chart of accounts carries. Posting rules refer to
 * these by code; organizations may add their own expense accounts on top.
 */
public enum LedgerAccount {

    ACCOUNTS_RECEIVABLE("1100", "Accounts Receivable", AccountType.ASSET),
    BANK("1200", "Bank Account", AccountType.ASSET),
    CASH("1210", "Cash in Hand", AccountType.ASSET),
    INVENTORY("1300", "Inventory", AccountType.ASSET),
    GST_INPUT_CGST("1410", "GST Input Credit - CGST", AccountType.ASSET),
    GST_INPUT_SGST("1420", "GST Input Credit - SGST", AccountType.ASSET),
    GST_INPUT_IGST("1430", "GST Input Credit - IGST", AccountType.ASSET),

    ACCOUNTS_PAYABLE("2100", "Accounts Payable", AccountType.LIABILITY),
    GST_PAYABLE_CGST("2210", "GST Payable - CGST", AccountType.LIABILITY),
    GST_PAYABLE_SGST("2220", "GST Payable - SGST", AccountType.LIABILITY),
    GST_PAYABLE_IGST("2230", "GST Payable - IGST", AccountType.LIABILITY),
    SALARY_PAYABLE("2310", "Salary Payable", AccountType.LIABILITY),
    TDS_PAYABLE("2320", "TDS Payable", AccountType.LIABILITY),
    EMPLOYEE_PF_PAYABLE("2330", "Employee PF Payable", AccountType.LIABILITY),
    EMPLOYER_PF_PAYABLE("2331", "Employer PF Payable", AccountType.LIABILITY),
    ESI_PAYABLE("2340", "ESI Payable", AccountType.LIABILITY),
    PROFESSIONAL_TAX_PAYABLE("2350", "Professional Tax Payable", AccountType.LIABILITY),

    RETAINED_EARNINGS("3100", "Retained Earnings", AccountType.EQUITY),
    OWNER_EQUITY("3200", "Owner's Equity", AccountType.EQUITY),
    OPENING_BALANCE_EQUITY("3300", "Opening Balance Equity", AccountType.EQUITY),

    SALES_REVENUE("4100", "Sales Revenue", AccountType.INCOME),
    SERVICE_REVENUE("4200", "Service Revenue", AccountType.INCOME),
    OTHER_INCOME("4900", "Other Income", AccountType.INCOME),

    PURCHASES("5000", "Purchases", AccountType.EXPENSE),
    COST_OF_GOODS_SOLD("5100", "Cost of Goods Sold", AccountType.EXPENSE),
    SALARY_EXPENSE("6100", "Salary Expense", AccountType.EXPENSE),
    EMPLOYER_PF_EXPENSE("6110", "Employer PF Contribution", AccountType.EXPENSE),
    EMPLOYER_ESI_EXPENSE("6120", "Employer ESI Contribution", AccountType.EXPENSE),
    RENT_EXPENSE("6200", "Rent Expense", AccountType.EXPENSE),
    UTILITIES_EXPENSE("6300", "Utilities Expense", AccountType.EXPENSE),
    OFFICE_SUPPLIES("6400", "Office Supplies", AccountType.EXPENSE),
    PROFESSIONAL_FEES("6500", "Professional Fees", AccountType.EXPENSE),
    DEPRECIATION_EXPENSE("6600", "Depreciation Expense", AccountType.EXPENSE),
    TRAVEL_EXPENSE("6710", "Travel & Conveyance", AccountType.EXPENSE),
    REPAIRS_EXPENSE("6720", "Repairs & Maintenance", AccountType.EXPENSE),
    ADVERTISING_EXPENSE("6730", "Advertising & Marketing", AccountType.EXPENSE),
    STAFF_WELFARE("6740", "Staff Welfare", AccountType.EXPENSE),
    COMMUNICATION_EXPENSE("6750", "Communication Expense", AccountType.EXPENSE),
    MISC_EXPENSE("6900", "Miscellaneous Expense", AccountType.EXPENSE);

    private static final Map<String, LedgerAccount> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(LedgerAccount::getCode, Function.identity()));

    private final String code;
    private final String accountName;
    private final AccountType type;

    LedgerAccount(String code, String accountName, AccountType type) {
        this.code = code;
        this.accountName = accountName;
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public String getAccountName() {
        return accountName;
    }

    public AccountType getType() {
        return type;
    }

    public AccountRef ref() {
        return new AccountRef(code, accountName);
    }

    public static Optional<LedgerAccount> fromCode(String code) {
        return Optional.ofNullable(code).map(BY_CODE::get);
    }
}
