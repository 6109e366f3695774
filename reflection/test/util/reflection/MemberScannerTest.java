package util.reflection;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;


public class MemberScannerTest {

   private static final Binding ALL_INSTANCE = Binding.of(BindingFlag.PUBLIC, BindingFlag.NON_PUBLIC, BindingFlag.INSTANCE);

   @Test
   public void testPrivateFieldsOfSuperclassesAreInvisible() {
      assertThat(MemberScanner.findField(Child.class, "_parentSecret", ALL_INSTANCE)).isNull();
      assertThat(MemberScanner.findField(Parent.class, "_parentSecret", ALL_INSTANCE)).isNotNull();
      assertThat(MemberScanner.findField(Child.class, "_inherited", ALL_INSTANCE)).isNotNull();
   }

   @Test
   public void testHiddenFieldResolvesToSubclass() {
      Field field = MemberScanner.findField(Child.class, "value", Binding.PUBLIC_INSTANCE);
      assertThat(field.getDeclaringClass()).isEqualTo(Child.class);
      assertThat(field.getType()).isEqualTo(String.class);
   }

   @Test
   public void testPrivateFieldDoesNotHideInheritedPublicField() {
      assertThat(MemberScanner.findField(Child.class, "shadowed", Binding.PUBLIC_INSTANCE).getDeclaringClass()).isEqualTo(Parent.class);
      assertThat(MemberScanner.findField(Child.class, "shadowed", ALL_INSTANCE).getDeclaringClass()).isEqualTo(Child.class);
      assertThat(Reflection.read(new Child(), "shadowed")).isEqualTo(1);
   }

   @Test
   public void testInterfaceConstant() {
      Field field = MemberScanner.findField(Child.class, "NAME", Binding.PUBLIC_STATIC);
      assertThat(field.getDeclaringClass()).isEqualTo(Named.class);
   }

   @Test
   public void testOverriddenMethodIsListedOnce() {
      List<Method> methods = MemberScanner.methodsNamed(Child.class, "greet", Binding.PUBLIC_INSTANCE);
      assertThat(methods).hasSize(1);
      assertThat(methods.get(0).getDeclaringClass()).isEqualTo(Child.class);
   }

   @Test
   public void testDefaultMethodOfInterface() {
      List<Method> methods = MemberScanner.methodsNamed(Child.class, "describeName", Binding.PUBLIC_INSTANCE);
      assertThat(methods).hasSize(1);
      assertThat(methods.get(0).getDeclaringClass()).isEqualTo(Named.class);
   }

   @Test
   public void testNonPublicMethods() {
      assertThat(MemberScanner.methodsNamed(Child.class, "helper", Binding.PUBLIC_INSTANCE)).isEmpty();
      assertThat(MemberScanner.methodsNamed(Child.class, "helper", ALL_INSTANCE)).hasSize(1);
   }

   @Test
   public void testPropertyWithMatchingSetterOverload() {
      Property property = MemberScanner.findProperty(Child.class, "count", Binding.PUBLIC_INSTANCE);
      assertThat(property.getGetter().getName()).isEqualTo("getCount");
      assertThat(property.getSetter().getParameterTypes()).containsExactly(int.class);
   }

   @Test
   public void testWriteOnlyProperty() {
      Property property = MemberScanner.findProperty(Child.class, "password", Binding.PUBLIC_INSTANCE);
      assertThat(property.canRead()).isFalse();
      assertThat(property.getType()).isEqualTo(String.class);
   }

   @Test
   public void testPropertyNameFollowsBeanConventions() {
      assertThat(MemberScanner.findProperty(Child.class, "URL", Binding.PUBLIC_INSTANCE)).isNotNull();
      assertThat(MemberScanner.findProperty(Child.class, "uRL", Binding.PUBLIC_INSTANCE)).isNull();
      assertThat(MemberScanner.findProperty(Child.class, "class", Binding.PUBLIC_INSTANCE)).isNull();
   }

   @Test
   public void testListIndexer() {
      List<String> list = new ArrayList<>(List.of("a", "b"));
      IndexedProperty indexer = MemberScanner.findIndexer(list.getClass());
      assertThat(indexer.getName()).isEmpty();
      assertThat(indexer.getGetter().getName()).isEqualTo("get");
      assertThat(indexer.getSetter().getName()).isEqualTo("set");

      assertThat(Reflection.readIndexer(list, 1)).isEqualTo("b");
      Reflection.writeIndexer(list, "z", 0);
      assertThat(list).containsExactly("z", "b");
   }

   @Test
   public void testReadOnlyIndexer() {
      IndexedProperty indexer = MemberScanner.findIndexer(Child.class);
      assertThat(indexer.getName()).isEqualTo("entry");
      assertThat(indexer.canWrite()).isFalse();
      assertThat(indexer.get(new Child(), "k", 2)).isEqualTo("k2");
   }

   @Test
   public void testStaticMembersAreScannedSeparately() {
      assertThat(MemberScanner.methodsNamed(Child.class, "create", Binding.PUBLIC_INSTANCE)).isEmpty();
      assertThat(MemberScanner.methodsNamed(Child.class, "create", Binding.PUBLIC_STATIC)).hasSize(1);
   }


   public interface Named {

      String NAME = "named";

      default String describeName() {
         return NAME;
      }
   }


   public static class Parent {

      public int value;

      public int shadowed = 1;

      protected int _inherited;

      private int _parentSecret;

      public String greet() {
         return "parent";
      }
   }


   public static class Child extends Parent implements Named {

      public static Child create() {
         return new Child();
      }

      public String value;

      private int shadowed = 2;

      private int _count;

      public int getCount() {
         return _count;
      }

      public String getEntry( String key, int index ) {
         return key + index;
      }

      public String getURL() {
         return "url";
      }

      @Override
      public String greet() {
         return "child";
      }

      public void setCount( String count ) {
         _count = Integer.parseInt(count);
      }

      public void setCount( int count ) {
         _count = count;
      }

      public void setPassword( String password ) {}

      void helper() {}
   }
}
