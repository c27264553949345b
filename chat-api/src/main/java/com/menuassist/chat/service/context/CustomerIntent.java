package com.menuassist.chat.service.context;

public enum CustomerIntent {
    BROWSING("Customer intent: browsing. Describe items and answer the question; do not mention prices, "
            + "combos or add-ons unless the customer asks about them."),
    ORDERING("Customer intent: ordering. Prices, pairings and add-on suggestions are welcome.");

    private final String directive;

    CustomerIntent(String directive) {
        this.directive = directive;
    }

    public String directive() {
        return directive;
    }
}
