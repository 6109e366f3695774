package util.reflection;

import static com.google.common.base.Preconditions.checkNotNull;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.primitives.Primitives;


/**
 * Access to commonly used reflection features via a relatively simple interface.
 * <p>
 * Unlike the plain reflection API, looking up an unknown member never yields <code>null</code> or an empty result. It fails with a
 * {@link NotFoundException} naming the type, the member and the {@link Binding} involved. Type searches over several modules fail with an
 * {@link AmbiguousTypeNameException} if the name is not unique.
 * <p>
 * Instance members are looked up with {@link Binding#PUBLIC_INSTANCE}, static members with {@link Binding#PUBLIC_STATIC}. Nothing is cached.
 */
public final class Reflection {

   private static final Joiner TYPE_JOINER = Joiner.on(',');

   /**
    * Searches all currently loaded modules for a type with the specified name.
    *
    * @see TypeRegistry#current()
    */
   public static Class<?> getExpectedType( String typeName ) {
      return getExpectedType(TypeRegistry.current(), typeName);
   }

   public static Class<?> getExpectedType( TypeRegistry registry, String typeName ) {
      return registry.getExpectedType(checkNotNull(typeName));
   }

   public static Class<?> getExpectedType( Module module, String typeName ) {
      return getExpectedType(TypeSource.of(module), typeName);
   }

   /**
    * Returns the type with the specified name of a single module. There can be at most one, so unlike the search over all modules this never
    * fails for ambiguity.
    */
   public static Class<?> getExpectedType( TypeSource source, String typeName ) {
      Class<?> type = source.findType(checkNotNull(typeName));
      if ( type == null ) {
         throw new NotFoundException("Type '" + typeName + "' not found in module '" + source.getName() + "'.");
      }
      return type;
   }

   public static Field getExpectedField( Class<?> type, String fieldName ) {
      return getExpectedField(type, fieldName, Binding.PUBLIC_INSTANCE);
   }

   public static Field getExpectedField( Class<?> type, String fieldName, Binding binding ) {
      Field field = MemberScanner.findField(type, checkNotNull(fieldName), binding);
      if ( field == null ) {
         throw new NotFoundException("Type '" + type.getSimpleName() + "' has no field named '" + fieldName + "' for binding " + binding + ".");
      }
      return field;
   }

   public static Property getExpectedProperty( Class<?> type, String propertyName ) {
      return getExpectedProperty(type, propertyName, Binding.PUBLIC_INSTANCE);
   }

   public static Property getExpectedProperty( Class<?> type, String propertyName, Binding binding ) {
      Property property = MemberScanner.findProperty(type, checkNotNull(propertyName), binding);
      if ( property == null ) {
         throw new NotFoundException("Type '" + type.getSimpleName() + "' has no property named '" + propertyName + "' for binding " + binding + ".");
      }
      return property;
   }

   public static MemberAccessor getExpectedFieldOrProperty( Class<?> type, String fieldOrPropertyName ) {
      return getExpectedFieldOrProperty(type, fieldOrPropertyName, Binding.PUBLIC_INSTANCE);
   }

   /**
    * Fields take precedence over properties of the same name.
    */
   public static MemberAccessor getExpectedFieldOrProperty( Class<?> type, String fieldOrPropertyName, Binding binding ) {
      checkNotNull(fieldOrPropertyName);
      Field field = MemberScanner.findField(type, fieldOrPropertyName, binding);
      if ( field != null ) {
         return new FieldMemberAccessor(field);
      }
      Property property = MemberScanner.findProperty(type, fieldOrPropertyName, binding);
      if ( property != null ) {
         return property;
      }
      throw new NotFoundException(
            "Type '" + type.getSimpleName() + "' has no field or property named '" + fieldOrPropertyName + "' for binding " + binding + ".");
   }

   public static IndexedProperty getExpectedIndexer( Class<?> type ) {
      IndexedProperty indexer = MemberScanner.findIndexer(type);
      if ( indexer == null ) {
         throw new NotFoundException("Type '" + type.getSimpleName() + "' has no indexer property.");
      }
      return indexer;
   }

   public static Method getExpectedMethod( Class<?> type, String methodName ) {
      return getExpectedMethod(type, methodName, Binding.PUBLIC_INSTANCE);
   }

   /**
    * @throws AmbiguousMatchException if the method is overloaded
    */
   public static Method getExpectedMethod( Class<?> type, String methodName, Binding binding ) {
      List<Method> methods = MemberScanner.methodsNamed(type, checkNotNull(methodName), binding);
      if ( methods.isEmpty() ) {
         throw new NotFoundException("Method '" + type.getSimpleName() + "." + methodName + "' not found for binding " + binding + ".");
      }
      if ( methods.size() > 1 ) {
         throw new AmbiguousMatchException("Ambiguous match found for method '" + type.getSimpleName() + "." + methodName + "', " + methods.size()
               + " overloads for binding " + binding + ".");
      }
      return methods.get(0);
   }

   public static Method getExpectedMethod( Class<?> type, String methodName, Class<?>[] types ) {
      return getExpectedMethod(type, methodName, types, Binding.PUBLIC_INSTANCE);
   }

   /**
    * Returns the method whose parameter types are exactly <code>types</code>. No assignability or boxing is considered.
    */
   public static Method getExpectedMethod( Class<?> type, String methodName, Class<?>[] types, Binding binding ) {
      checkNotNull(types);
      for ( Method method : MemberScanner.methodsNamed(type, checkNotNull(methodName), binding) ) {
         if ( Arrays.equals(method.getParameterTypes(), types) ) {
            return method;
         }
      }
      throw new NotFoundException("Method '" + type.getSimpleName() + "." + signature(methodName, types) + "' not found for binding " + binding + ".");
   }

   public static Object readStatic( Class<?> type, String fieldOrPropertyName ) {
      return getExpectedFieldOrProperty(type, fieldOrPropertyName, Binding.PUBLIC_STATIC).get(null);
   }

   public static void writeStatic( Class<?> type, String fieldOrPropertyName, @Nullable Object value ) {
      getExpectedFieldOrProperty(type, fieldOrPropertyName, Binding.PUBLIC_STATIC).set(null, value);
   }

   /**
    * Invokes the static method with the specified name. Fails if the method is overloaded.
    */
   public static Object invokeStaticMethod( Class<?> type, String methodName, Object... parameters ) {
      Method method = getExpectedMethod(type, methodName, Binding.PUBLIC_STATIC);
      return Invoker.invoke(method, null, parameters);
   }

   /**
    * Invokes the static method with the specified name and signature.
    */
   public static Object invokeStaticMethod( Class<?> type, String methodName, Class<?>[] types, Object[] parameters ) {
      Method method = getExpectedMethod(type, methodName, types, Binding.PUBLIC_STATIC);
      return Invoker.invoke(method, null, parameters);
   }

   /**
    * Invokes the static method with the specified name, selecting the overload by the runtime types of the parameters.
    *
    * @throws NullArgumentException if any parameter is <code>null</code>
    */
   public static Object invokeStaticMethodWithNonNullParameters( Class<?> type, String methodName, Object... parameters ) {
      return invokeMethodWithNonNullParameters(type, null, methodName, Binding.PUBLIC_STATIC, parameters);
   }

   public static Object read( Object instance, String fieldOrPropertyName ) {
      return getExpectedFieldOrProperty(instance.getClass(), fieldOrPropertyName, Binding.PUBLIC_INSTANCE).get(instance);
   }

   public static void write( Object instance, String fieldOrPropertyName, @Nullable Object value ) {
      getExpectedFieldOrProperty(instance.getClass(), fieldOrPropertyName, Binding.PUBLIC_INSTANCE).set(instance, value);
   }

   public static Object readIndexer( Object instance, Object... indexes ) {
      return getExpectedIndexer(instance.getClass()).get(instance, indexes);
   }

   public static void writeIndexer( Object instance, @Nullable Object value, Object... indexes ) {
      getExpectedIndexer(instance.getClass()).set(instance, value, indexes);
   }

   /**
    * Invokes the method with the specified name and signature.
    * <p>
    * This is the most precise variant, but requires the types array to match the desired method exactly.
    */
   public static Object invokeMethod( Object instance, String methodName, Class<?>[] types, Object[] parameters ) {
      Method method = getExpectedMethod(instance.getClass(), methodName, types, Binding.PUBLIC_INSTANCE);
      return Invoker.invoke(method, instance, parameters);
   }

   /**
    * Invokes the method with the specified name. Fails if the method is overloaded, even if the overloads differ in their number of parameters.
    */
   public static Object invokeMethod( Object instance, String methodName, Object... parameters ) {
      Method method = getExpectedMethod(instance.getClass(), methodName, Binding.PUBLIC_INSTANCE);
      return Invoker.invoke(method, instance, parameters);
   }

   /**
    * Invokes the method with the specified name, selecting the overload by the runtime types of the parameters. Allows choosing between
    * overloads with the same number of parameters, but only if each parameter value is non-null.
    *
    * @throws NullArgumentException if any parameter is <code>null</code>
    */
   public static Object invokeMethodWithNonNullParameters( Object instance, String methodName, Object... parameters ) {
      return invokeMethodWithNonNullParameters(instance.getClass(), instance, methodName, Binding.PUBLIC_INSTANCE, parameters);
   }

   private static Object invokeMethodWithNonNullParameters( Class<?> type, @Nullable Object instance, String methodName, Binding binding,
         Object[] parameters ) {
      Class<?>[] types = new Class<?>[parameters.length];
      for ( int i = 0; i < parameters.length; i++ ) {
         if ( parameters[i] == null ) {
            throw new NullArgumentException("All parameters must be non-null.");
         }
         types[i] = parameters[i].getClass();
      }
      Method method = getMethodForArgumentTypes(type, methodName, types, binding);
      return Invoker.invoke(method, instance, parameters);
   }

   /**
    * Like {@link #getExpectedMethod(Class, String, Class[], Binding)}, except that a primitive parameter type also matches its wrapper, since the
    * runtime type of an argument is never primitive. An exact match takes precedence.
    */
   private static Method getMethodForArgumentTypes( Class<?> type, String methodName, Class<?>[] argumentTypes, Binding binding ) {
      Method boxedMatch = null;
      for ( Method method : MemberScanner.methodsNamed(type, checkNotNull(methodName), binding) ) {
         Class<?>[] parameterTypes = method.getParameterTypes();
         if ( Arrays.equals(parameterTypes, argumentTypes) ) {
            return method;
         }
         if ( boxedMatch == null && Arrays.equals(wrap(parameterTypes), argumentTypes) ) {
            boxedMatch = method;
         }
      }
      if ( boxedMatch == null ) {
         throw new NotFoundException(
               "Method '" + type.getSimpleName() + "." + signature(methodName, argumentTypes) + "' not found for binding " + binding + ".");
      }
      return boxedMatch;
   }

   private static String signature( String methodName, Class<?>[] types ) {
      return methodName + "(" + TYPE_JOINER.join(Arrays.stream(types).map(Class::getSimpleName).iterator()) + ")";
   }

   private static Class<?>[] wrap( Class<?>[] types ) {
      Class<?>[] wrapped = new Class<?>[types.length];
      for ( int i = 0; i < types.length; i++ ) {
         wrapped[i] = Primitives.wrap(types[i]);
      }
      return wrapped;
   }

   private Reflection() {}


   /**
    * Thrown when looking up a type or a member that doesn't exist.
    */
   public static class NotFoundException extends IllegalArgumentException {

      private static final long serialVersionUID = 3061844914563206158L;

      public NotFoundException( String message ) {
         super(message);
      }
   }


   /**
    * Thrown when a type search over several modules finds more than one type of the requested name.
    */
   public static class AmbiguousTypeNameException extends IllegalArgumentException {

      private static final long serialVersionUID = -2316476101383850462L;

      public AmbiguousTypeNameException( String message ) {
         super(message);
      }
   }


   /**
    * Thrown when a method is looked up by name only and that name is overloaded.
    */
   public static class AmbiguousMatchException extends RuntimeException {

      private static final long serialVersionUID = 8203597734601235534L;

      public AmbiguousMatchException( String message ) {
         super(message);
      }
   }


   public static class NullArgumentException extends NullPointerException {

      private static final long serialVersionUID = -4405170860473744416L;

      public NullArgumentException( String message ) {
         super(message);
      }
   }
}
