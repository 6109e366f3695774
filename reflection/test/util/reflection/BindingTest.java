package util.reflection;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Modifier;

import org.junit.Test;


public class BindingTest {

   @Test
   public void testToString() {
      assertThat(Binding.PUBLIC_INSTANCE).hasToString("[Public|Instance]");
      assertThat(Binding.PUBLIC_STATIC).hasToString("[Public|Static]");
      assertThat(Binding.of(BindingFlag.STATIC, BindingFlag.NON_PUBLIC, BindingFlag.PUBLIC)).hasToString("[Public|NonPublic|Static]");
   }

   @Test
   public void testFlags() {
      assertThat(Binding.PUBLIC_STATIC.getFlags()).containsExactly(BindingFlag.PUBLIC, BindingFlag.STATIC);
      assertThat(Binding.PUBLIC_STATIC.contains(BindingFlag.INSTANCE)).isFalse();
   }

   @Test
   public void testMatches() {
      assertThat(Binding.PUBLIC_INSTANCE.matches(Modifier.PUBLIC)).isTrue();
      assertThat(Binding.PUBLIC_INSTANCE.matches(Modifier.PUBLIC | Modifier.STATIC)).isFalse();
      assertThat(Binding.PUBLIC_INSTANCE.matches(Modifier.PRIVATE)).isFalse();
      assertThat(Binding.PUBLIC_INSTANCE.matches(0)).isFalse();

      assertThat(Binding.PUBLIC_STATIC.matches(Modifier.PUBLIC | Modifier.STATIC | Modifier.FINAL)).isTrue();
      assertThat(Binding.PUBLIC_STATIC.matches(Modifier.PUBLIC)).isFalse();

      Binding nonPublicStatic = Binding.of(BindingFlag.NON_PUBLIC, BindingFlag.STATIC);
      assertThat(nonPublicStatic.matches(Modifier.PROTECTED | Modifier.STATIC)).isTrue();
      assertThat(nonPublicStatic.matches(Modifier.STATIC)).isTrue();
      assertThat(nonPublicStatic.matches(Modifier.PUBLIC | Modifier.STATIC)).isFalse();
   }

   @Test
   public void testMatchesNothingWithoutScope() {
      Binding publicOnly = Binding.of(BindingFlag.PUBLIC);
      assertThat(publicOnly.matches(Modifier.PUBLIC)).isFalse();
      assertThat(publicOnly.matches(Modifier.PUBLIC | Modifier.STATIC)).isFalse();
   }

   @Test
   public void testEquals() {
      assertThat(Binding.of(BindingFlag.INSTANCE, BindingFlag.PUBLIC)).isEqualTo(Binding.PUBLIC_INSTANCE).hasSameHashCodeAs(Binding.PUBLIC_INSTANCE);
      assertThat(Binding.PUBLIC_INSTANCE).isNotEqualTo(Binding.PUBLIC_STATIC);
   }
}
