package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Purchases: {@code On 2024-04-12, I bought Dune (books) at Powell's for 18.99 USD.} */
@Component
@Order(3)
public class PurchaseVerbalizer extends TemplateRecordVerbalizer {

  public PurchaseVerbalizer() {
    super(SourceType.PURCHASE, List.of("item"), defaults(), Set.of("price"));
  }

  private static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("category", null);
    defaults.put("store", null);
    defaults.put("price", null);
    defaults.put("currency", "USD");
    return defaults;
  }

  @Override
  protected String describe(SortedMap<String, String> fields) {
    StringBuilder sentence = new StringBuilder("I bought ").append(fields.get("item"));
    if (fields.containsKey("category")) {
      sentence.append(" (").append(lower(fields.get("category"))).append(")");
    }
    sentence.append(optional(fields, "store", " at "));
    String price = fields.get("price");
    if (price != null) {
      sentence
          .append(" for ")
          .append(new BigDecimal(price).setScale(2, RoundingMode.HALF_UP).toPlainString())
          .append(" ")
          .append(fields.get("currency"));
    }
    return sentence.toString();
  }
}
