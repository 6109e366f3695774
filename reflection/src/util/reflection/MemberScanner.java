package util.reflection;

import java.beans.Introspector;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;


/**
 * Enumerates the members of a type visible under a {@link Binding}. Nothing is cached, every call reflects on the type anew.
 * <p>
 * The type itself is scanned first, then its superclasses; a member declared further down the hierarchy hides or overrides the ones above it.
 * Private members of superclasses are never visible. Bridge and synthetic members are skipped.
 */
final class MemberScanner {

   private static final Comparator<Method> INDEXER_ORDER = Comparator.comparing(Method::getName)
         .thenComparingInt(Method::getParameterCount)
         .thenComparing(m -> Arrays.toString(m.getParameterTypes()));

   static List<Field> fields( Class<?> type, Binding binding ) {
      Set<String> seen = new HashSet<>();
      List<Field> fields = new ArrayList<>();
      for ( Class<?> c = type; c != null; c = c.getSuperclass() ) {
         for ( Field field : c.getDeclaredFields() ) {
            // an invisible field does not hide an inherited one of the same name
            if ( isVisible(type, c, field.getModifiers(), field.isSynthetic(), binding) && seen.add(field.getName()) ) {
               fields.add(field);
            }
         }
      }
      if ( binding.contains(BindingFlag.PUBLIC) ) {
         // interface constants
         for ( Field field : type.getFields() ) {
            if ( binding.matches(field) && seen.add(field.getName()) ) {
               fields.add(field);
            }
         }
      }
      return fields;
   }

   @Nullable
   static Field findField( Class<?> type, String name, Binding binding ) {
      for ( Field field : fields(type, binding) ) {
         if ( field.getName().equals(name) ) {
            return field;
         }
      }
      return null;
   }

   @Nullable
   static IndexedProperty findIndexer( Class<?> type ) {
      List<Method> methods = methods(type, Binding.PUBLIC_INSTANCE);
      List<Method> getters = new ArrayList<>();
      for ( Method method : methods ) {
         if ( method.getParameterCount() > 0 && method.getReturnType() != void.class && accessorSuffix(method.getName(), "get") != null ) {
            getters.add(method);
         }
      }
      if ( getters.isEmpty() ) {
         return null;
      }
      getters.sort(INDEXER_ORDER);

      Method getter = getters.get(0);
      String suffix = accessorSuffix(getter.getName(), "get");
      Class<?>[] setterParameterTypes = Arrays.copyOf(getter.getParameterTypes(), getter.getParameterCount() + 1);
      setterParameterTypes[getter.getParameterCount()] = getter.getReturnType();
      Method setter = null;
      for ( Method method : methods ) {
         if ( method.getName().equals("set" + suffix) && Arrays.equals(method.getParameterTypes(), setterParameterTypes) ) {
            setter = method;
            break;
         }
      }
      return new IndexedProperty(Introspector.decapitalize(suffix), getter, setter);
   }

   @Nullable
   static Property findProperty( Class<?> type, String name, Binding binding ) {
      Method getter = null;
      List<Method> setters = new ArrayList<>();
      for ( Method method : methods(type, binding) ) {
         if ( method.getDeclaringClass() == Object.class ) {
            continue;
         }
         String methodName = method.getName();
         if ( method.getParameterCount() == 0 && getter == null ) {
            if ( method.getReturnType() != void.class && name.equals(propertyName(methodName, "get")) ) {
               getter = method;
               continue;
            }
            if ( method.getReturnType() == boolean.class && name.equals(propertyName(methodName, "is")) ) {
               getter = method;
               continue;
            }
         }
         if ( method.getParameterCount() == 1 && name.equals(propertyName(methodName, "set")) ) {
            setters.add(method);
         }
      }

      if ( getter == null && setters.isEmpty() ) {
         return null;
      }
      Method setter = setters.isEmpty() ? null : setters.get(0);
      if ( getter != null ) {
         for ( Method candidate : setters ) {
            if ( candidate.getParameterTypes()[0] == getter.getReturnType() ) {
               setter = candidate;
               break;
            }
         }
      }
      return new Property(name, getter, setter);
   }

   static List<Method> methods( Class<?> type, Binding binding ) {
      // bridges count as seen, so an erased generic method of a superclass stays hidden behind its override
      Set<List<Object>> seen = new HashSet<>();
      List<Method> methods = new ArrayList<>();
      for ( Class<?> c = type; c != null; c = c.getSuperclass() ) {
         for ( Method method : c.getDeclaredMethods() ) {
            if ( seen.add(signatureOf(method)) && !method.isBridge() && isVisible(type, c, method.getModifiers(), method.isSynthetic(), binding) ) {
               methods.add(method);
            }
         }
      }
      if ( binding.contains(BindingFlag.PUBLIC) ) {
         // default methods of interfaces
         for ( Method method : type.getMethods() ) {
            if ( seen.add(signatureOf(method)) && !method.isBridge() && !method.isSynthetic() && binding.matches(method) ) {
               methods.add(method);
            }
         }
      }
      return methods;
   }

   static List<Method> methodsNamed( Class<?> type, String name, Binding binding ) {
      List<Method> named = new ArrayList<>();
      for ( Method method : methods(type, binding) ) {
         if ( method.getName().equals(name) ) {
            named.add(method);
         }
      }
      return named;
   }

   /**
    * @return the part of <code>methodName</code> after <code>prefix</code>, which is either empty or starts with an uppercase letter; <code>null</code> otherwise
    */
   @Nullable
   private static String accessorSuffix( String methodName, String prefix ) {
      if ( !methodName.startsWith(prefix) ) {
         return null;
      }
      String suffix = methodName.substring(prefix.length());
      if ( suffix.isEmpty() || Character.isUpperCase(suffix.charAt(0)) ) {
         return suffix;
      }
      return null;
   }

   /**
    * @return the bean property name of an accessor, e.g. <code>url</code> for <code>getUrl</code> and <code>URL</code> for <code>getURL</code>
    */
   @Nullable
   private static String propertyName( String methodName, String prefix ) {
      String suffix = accessorSuffix(methodName, prefix);
      return suffix == null || suffix.isEmpty() ? null : Introspector.decapitalize(suffix);
   }

   private static boolean isVisible( Class<?> type, Class<?> declaringClass, int modifiers, boolean synthetic, Binding binding ) {
      if ( synthetic ) {
         return false;
      }
      if ( declaringClass != type && Modifier.isPrivate(modifiers) ) {
         return false;
      }
      return binding.matches(modifiers);
   }

   private static List<Object> signatureOf( Method method ) {
      return List.of(method.getName(), Arrays.asList(method.getParameterTypes()));
   }

   private MemberScanner() {}
}
