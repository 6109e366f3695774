package util.reflection;

import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;

import javax.annotation.Nullable;


/**
 * A bean property, i.e. a <code>getX()</code>/<code>isX()</code> getter and/or a <code>setX(value)</code> setter sharing the decapitalized name <code>x</code>.
 * At least one of the two accessors is present.
 */
public class Property implements MemberAccessor {

   private final String _name;
   private final Method _getter;
   private final Method _setter;

   public Property( String name, @Nullable Method getter, @Nullable Method setter ) {
      if ( getter == null && setter == null ) {
         throw new IllegalArgumentException("property '" + name + "' needs a getter or a setter");
      }
      _name = name;
      _getter = getter;
      _setter = setter;
   }

   public boolean canRead() {
      return _getter != null;
   }

   public boolean canWrite() {
      return _setter != null;
   }

   @Override
   public Object get( @Nullable Object obj ) {
      if ( _getter == null ) {
         throw new IllegalStateException("Property '" + _name + "' of type '" + getDeclaringClass().getSimpleName() + "' has no getter.");
      }
      return Invoker.invoke(_getter, obj);
   }

   @Override
   public Class<?> getDeclaringClass() {
      return getMember().getDeclaringClass();
   }

   @Override
   public Type getGenericType() {
      return _getter != null ? _getter.getGenericReturnType() : _setter.getGenericParameterTypes()[0];
   }

   @Nullable
   public Method getGetter() {
      return _getter;
   }

   @Override
   public Member getMember() {
      return _getter != null ? _getter : _setter;
   }

   @Override
   public String getName() {
      return _name;
   }

   @Nullable
   public Method getSetter() {
      return _setter;
   }

   @Override
   public Class<?> getType() {
      return _getter != null ? _getter.getReturnType() : _setter.getParameterTypes()[0];
   }

   @Override
   public boolean isStatic() {
      return Modifier.isStatic(getMember().getModifiers());
   }

   @Override
   public void set( @Nullable Object obj, @Nullable Object value ) {
      if ( _setter == null ) {
         throw new IllegalStateException("Property '" + _name + "' of type '" + getDeclaringClass().getSimpleName() + "' has no setter.");
      }
      Invoker.invoke(_setter, obj, value);
   }

   @Override
   public String toString() {
      return "property " + getDeclaringClass().getSimpleName() + "." + _name;
   }
}
