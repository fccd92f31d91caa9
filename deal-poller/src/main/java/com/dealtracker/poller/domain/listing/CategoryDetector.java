package com.dealtracker.poller.domain.listing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Keyword-based category for listings the marketplace leaves uncategorised.
 *
 * <p>Each category scores one point per whole-word keyword hit in the name and description. The
 * highest score wins; ties go to the category declared first.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CategoryDetector {

    public static final String OTHER = "Other";

    private static final Map<String, List<Pattern>> KEYWORDS = new LinkedHashMap<>();

    static {
        register("Produce", "apple", "banana", "orange", "grape", "berry", "strawberry", "blueberry",
                "raspberry", "lettuce", "spinach", "kale", "carrot", "potato", "onion", "tomato", "cucumber",
                "pepper", "broccoli", "cauliflower", "celery", "avocado", "lemon", "lime", "peach", "pear",
                "plum", "cherry", "melon", "watermelon", "cabbage", "zucchini", "squash", "mushroom", "garlic",
                "ginger", "herbs", "salad", "organic", "fresh", "produce", "fruit", "vegetable", "veggie");
        register("Meat", "chicken", "beef", "pork", "turkey", "lamb", "fish", "salmon", "tuna", "ground",
                "steak", "roast", "chops", "wings", "thighs", "breast", "bacon", "ham", "sausage", "deli",
                "meat", "ribeye", "sirloin", "tenderloin", "brisket", "ribs", "drumstick");
        register("Dairy", "milk", "cheese", "yogurt", "butter", "cream", "sour cream", "cottage cheese",
                "cheddar", "mozzarella", "parmesan", "brie", "ice cream", "dairy", "lactose", "eggs", "egg");
        register("Bakery", "bread", "buns", "rolls", "bagels", "muffins", "croissant", "pastry", "cake",
                "cookies", "pie", "tart", "donut", "danish", "scone", "bakery", "fresh baked", "sourdough",
                "baguette", "focaccia", "pretzel");
        register("Frozen", "frozen", "ice cream", "frozen yogurt", "frozen pizza", "frozen meals", "ice",
                "popsicle", "sorbet", "gelato");
        register("Pantry", "pasta", "rice", "beans", "lentils", "quinoa", "oats", "cereal", "flour", "sugar",
                "spices", "oil", "vinegar", "sauce", "dressing", "canned", "dried", "honey", "syrup", "jam",
                "peanut butter");
        register("Snacks", "chips", "crackers", "popcorn", "pretzels", "nuts", "trail mix", "granola",
                "protein bar", "candy", "chocolate", "snack", "treats", "jerky");
        register("Beverages", "water", "juice", "soda", "pop", "coffee", "tea", "energy drink", "kombucha",
                "smoothie", "sparkling", "drink", "beverage", "bottle");
        register("Health & Beauty", "shampoo", "conditioner", "soap", "lotion", "deodorant", "toothpaste",
                "toothbrush", "vitamins", "supplements", "medicine", "beauty", "cosmetics", "skincare");
        register("Pet Food", "dog food", "cat food", "pet food", "dog treats", "cat treats", "dog", "cat",
                "pet", "kibble");
    }

    public static String detect(String name, String description) {
        var text = ((name == null ? "" : name) + " " + (description == null ? "" : description))
                .toLowerCase(Locale.ROOT);
        var best = OTHER;
        var bestScore = 0;
        for (var entry : KEYWORDS.entrySet()) {
            var score = 0;
            for (var pattern : entry.getValue()) {
                var matcher = pattern.matcher(text);
                while (matcher.find()) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    public static List<String> categories() {
        var all = new ArrayList<>(KEYWORDS.keySet());
        all.add(OTHER);
        return List.copyOf(all);
    }

    private static void register(String category, String... keywords) {
        KEYWORDS.put(category, Arrays.stream(keywords)
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"))
                .toList());
    }
}
