package com.codeheadsystems.secagg.weights;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WeightMapTest {

  @Test
  void builder_copiesInput() {
    float[] values = {1f, 2f};
    WeightMap map = WeightMap.builder().put("w", values).build();

    values[0] = 99f;

    assertThat(map.tensor("w")).containsExactly(1f, 2f);
  }

  @Test
  void tensor_returnsCopy() {
    WeightMap map = WeightMap.of("w", 1f, 2f);

    map.tensor("w")[0] = 99f;

    assertThat(map.tensor("w")).containsExactly(1f, 2f);
  }

  @Test
  void forEach_handsOutCopies() {
    WeightMap map = WeightMap.of("w", 1f, 2f);

    map.forEach((name, values) -> values[1] = -1f);

    assertThat(map.tensor("w")).containsExactly(1f, 2f);
  }

  @Test
  void names_keepInsertionOrder() {
    Map<String, float[]> source = new LinkedHashMap<>();
    source.put("z", new float[]{1});
    source.put("a", new float[]{2});
    source.put("m", new float[]{3});

    assertThat(WeightMap.of(source).names()).containsExactly("z", "a", "m");
  }

  @Test
  void tensor_unknownNameThrows() {
    assertThatThrownBy(() -> WeightMap.empty().tensor("missing"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void lengthAndCounts() {
    WeightMap map = WeightMap.builder().put("a", new float[3]).put("b", new float[5]).build();

    assertThat(map.length("a")).isEqualTo(3);
    assertThat(map.length("nope")).isEqualTo(-1);
    assertThat(map.size()).isEqualTo(2);
    assertThat(map.elementCount()).isEqualTo(8);
  }

  @Test
  void zerosLike_keepsShape() {
    WeightMap map = WeightMap.builder().put("a", new float[]{1, 2}).put("b", new float[]{3}).build();

    WeightMap zeros = map.zerosLike();

    assertThat(zeros.tensor("a")).containsExactly(0f, 0f);
    assertThat(zeros.tensor("b")).containsExactly(0f);
  }

  @Test
  void equals_comparesContentAndType() {
    WeightMap a = WeightMap.of("w", 1f, 2f);
    WeightMap b = WeightMap.of("w", 1f, 2f);
    WeightDelta d = WeightDelta.of("w", 1f, 2f);

    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a).isNotEqualTo(WeightMap.of("w", 1f, 3f));
    assertThat(a).isNotEqualTo(d);
    assertThat(d).isNotEqualTo(a);
    assertThat(WeightDelta.from(a)).isEqualTo(d).hasSameHashCodeAs(d);
  }

  @Test
  void weightDeltaFrom_reusesExistingDelta() {
    WeightDelta delta = WeightDelta.of("w", 1f);

    assertThat(WeightDelta.from(delta)).isSameAs(delta);
    assertThat(WeightDelta.from(WeightMap.of("w", 1f))).isEqualTo(delta);
  }

  @Test
  void builder_rejectsNulls() {
    assertThatThrownBy(() -> WeightMap.builder().put(null, new float[1]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> WeightMap.builder().put("w", null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
