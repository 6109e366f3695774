package util.reflection;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Arrays;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Throwables;
import com.google.common.reflect.TypeToken;


/**
 * Performs the actual reflective get/set/invoke calls.
 * <p>
 * Exceptions thrown by the target propagate unchanged if unchecked, checked ones are wrapped in an {@link UndeclaredThrowableException}.
 * {@link IllegalArgumentException}s raised by the reflection layer itself (wrong arity, wrong argument type) are not touched.
 * <p>
 * A method of a class this library may not access, e.g. <code>size()</code> of the private list class behind <code>List.of(..)</code>, is invoked
 * through the same method of an accessible supertype.
 */
final class Invoker {

   private static final Logger _log = LoggerFactory.getLogger(Invoker.class);

   static Object get( Field field, @Nullable Object obj ) {
      makeAccessible(field);
      try {
         return field.get(obj);
      }
      catch ( IllegalAccessException argh ) {
         throw new IllegalStateException("Cannot read field " + field.getDeclaringClass().getName() + "." + field.getName(), argh);
      }
   }

   static Object invoke( Method method, @Nullable Object obj, @Nullable Object... args ) {
      _log.trace("invoking {} on {}", method, obj == null ? "<static>" : obj.getClass().getName());
      Method target = accessibleMethod(method);
      try {
         return target.invoke(obj, args);
      }
      catch ( InvocationTargetException e ) {
         Throwable cause = e.getCause();
         Throwables.throwIfUnchecked(cause);
         throw new UndeclaredThrowableException(cause);
      }
      catch ( IllegalAccessException argh ) {
         throw new IllegalStateException("Cannot invoke method " + method.getDeclaringClass().getName() + "." + method.getName(), argh);
      }
   }

   static void set( Field field, @Nullable Object obj, @Nullable Object value ) {
      makeAccessible(field);
      try {
         field.set(obj, value);
      }
      catch ( IllegalAccessException argh ) {
         throw new IllegalStateException("Cannot write field " + field.getDeclaringClass().getName() + "." + field.getName(), argh);
      }
   }

   /**
    * @return <code>method</code> itself if it can be made accessible, otherwise the same method of the most specific public supertype in an
    *         exported package, if there is one
    */
   private static Method accessibleMethod( Method method ) {
      if ( method.trySetAccessible() || Modifier.isStatic(method.getModifiers()) ) {
         return method;
      }
      for ( Class<?> supertype : TypeToken.of(method.getDeclaringClass()).getTypes().rawTypes() ) {
         if ( !isReachable(supertype) ) {
            continue;
         }
         for ( Method candidate : supertype.getMethods() ) {
            if ( candidate.getName().equals(method.getName()) && Arrays.equals(candidate.getParameterTypes(), method.getParameterTypes())
                  && isReachable(candidate.getDeclaringClass()) ) {
               _log.trace("{} is not accessible, using {}", method, candidate);
               return candidate;
            }
         }
      }
      _log.trace("{} is not accessible", method);
      return method;
   }

   private static boolean isReachable( Class<?> type ) {
      return Modifier.isPublic(type.getModifiers()) && type.getModule().isExported(type.getPackageName(), Invoker.class.getModule());
   }

   /**
    * Members of non-public classes are otherwise unreachable from this package, even if the member itself is public.
    * Where the module system forbids it, the subsequent access fails with an {@link IllegalAccessException}.
    */
   private static void makeAccessible( AccessibleObject member ) {
      if ( !member.trySetAccessible() ) {
         _log.trace("{} is not accessible", member);
      }
   }

   private Invoker() {}
}
