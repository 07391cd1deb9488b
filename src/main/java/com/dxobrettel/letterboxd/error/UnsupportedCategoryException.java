package com.dxobrettel.letterboxd.error;

public class UnsupportedCategoryException extends LetterboxdException {

    private final String category;

    public UnsupportedCategoryException(String category, String supported) {
        super("Found TMDb link with category '" + category + "', only '" + supported + "' is supported");
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
