package com.gearprice.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ListingConditionTest {

    @Test
    @DisplayName("specific phrases win over generic ones")
    void specificBeforeGeneric() {
        assertEquals(ListingCondition.LIKE_NEW,  ListingCondition.fromText("Like New"));
        assertEquals(ListingCondition.OPEN_BOX,  ListingCondition.fromText("Open box"));
        assertEquals(ListingCondition.VERY_GOOD, ListingCondition.fromText("Very Good"));
        assertEquals(ListingCondition.POOR,      ListingCondition.fromText("For parts or not working"));
    }

    @Test
    @DisplayName("marketplace vocabulary maps to the fixed set")
    void marketplaceVocabulary() {
        assertEquals(ListingCondition.NEW,         ListingCondition.fromText("Brand New"));
        assertEquals(ListingCondition.LIKE_NEW,    ListingCondition.fromText("Excellent"));
        assertEquals(ListingCondition.GOOD,        ListingCondition.fromText("Good"));
        assertEquals(ListingCondition.FAIR,        ListingCondition.fromText("Fair"));
        assertEquals(ListingCondition.REFURBISHED, ListingCondition.fromText("Seller refurbished"));
        assertEquals(ListingCondition.USED,        ListingCondition.fromText("Pre-Owned"));
    }

    @Test
    @DisplayName("blank, null and unrecognised text default to Used")
    void defaultsToUsed() {
        assertEquals(ListingCondition.USED, ListingCondition.fromText(null));
        assertEquals(ListingCondition.USED, ListingCondition.fromText(""));
        assertEquals(ListingCondition.USED, ListingCondition.fromText("B-Stock"));
    }
}
