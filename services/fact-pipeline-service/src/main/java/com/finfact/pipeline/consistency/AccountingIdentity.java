package com.finfact.pipeline.consistency;

import java.util.List;

public record AccountingIdentity(String name, String formula, String resultMetric, List<Operand> operands) {

    public static final List<AccountingIdentity> STANDARD = List.of(
        new AccountingIdentity(
            "cash_flow_sum",
            "net_cash_flow_operating + net_cash_flow_investing + net_cash_flow_financing + fx_effect_on_cash = net_increase_cash",
            "net_increase_cash",
            List.of(
                Operand.required("net_cash_flow_operating"),
                Operand.required("net_cash_flow_investing"),
                Operand.required("net_cash_flow_financing"),
                Operand.optional("fx_effect_on_cash")
            )
        ),
        new AccountingIdentity(
            "cash_end_eq_begin_plus_increase",
            "cash_begin + net_increase_cash = cash_end",
            "cash_end",
            List.of(Operand.required("cash_begin"), Operand.required("net_increase_cash"))
        ),
        new AccountingIdentity(
            "assets_eq_liabilities_plus_equity",
            "total_liabilities + total_equity = total_assets",
            "total_assets",
            List.of(Operand.required("total_liabilities"), Operand.required("total_equity", "total_equity_parent"))
        ),
        new AccountingIdentity(
            "assets_eq_liabilities_and_equity_total",
            "total_liabilities_equity = total_assets",
            "total_assets",
            List.of(Operand.required("total_liabilities_equity"))
        )
    );

    public record Operand(List<String> alternatives, boolean optional) {

        public static Operand required(String... metrics) {
            return new Operand(List.of(metrics), false);
        }

        public static Operand optional(String... metrics) {
            return new Operand(List.of(metrics), true);
        }
    }
}
