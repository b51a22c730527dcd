package wirelay.util.geometry;

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

class Vector2DTest {
  @Test
  void arithmetic() {
    Vector2D a = Vector2D.of(1, 2);
    Vector2D b = Vector2D.of(3, -4);

    assertThat(a.plus(b)).isEqualTo(Vector2D.of(4, -2));
    assertThat(a.minus(b)).isEqualTo(Vector2D.of(-2, 6));
    assertThat(a.times(2)).isEqualTo(Vector2D.of(2, 4));
    assertThat(a.times(b)).isEqualTo(Vector2D.of(3, -8));
    assertThat(b.dividedBy(2)).isEqualTo(Vector2D.of(1.5, -2));
    assertThat(a.negate()).isEqualTo(Vector2D.of(-1, -2));
  }

  @Test
  void elementwiseExtremes() {
    Vector2D a = Vector2D.of(1, 5);
    Vector2D b = Vector2D.of(3, 2);

    assertThat(a.max(b)).isEqualTo(Vector2D.of(3, 5));
    assertThat(a.min(b)).isEqualTo(Vector2D.of(1, 2));
    assertThat(a.max(Vector2D.ZERO)).isSameInstanceAs(a);
    assertThat(a.min(Vector2D.of(10, 10))).isSameInstanceAs(a);
  }

  @Test
  void translation() {
    Vector2D v = Vector2D.of(1, 1);

    assertThat(v.translate(2, -1)).isEqualTo(Vector2D.of(3, 0));
    assertThat(v.translate(Vector2D.of(-1, 0.5))).isEqualTo(Vector2D.of(0, 1.5));
    assertThat(v.translate(Vector2D.ZERO)).isSameInstanceAs(v);
  }
}
