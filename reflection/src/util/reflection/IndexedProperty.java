package util.reflection;

import java.lang.reflect.Method;
import java.util.Arrays;

import javax.annotation.Nullable;

import com.google.common.collect.ObjectArrays;


/**
 * An indexer: a getter <code>get(i...)</code> or <code>getX(i...)</code> taking one or more index parameters, optionally paired with a setter
 * <code>set(i..., value)</code> resp. <code>setX(i..., value)</code> whose last parameter has the getter's return type.
 * <p>
 * {@link java.util.List#get(int)} and {@link java.util.List#set(int, Object)} form an indexer, as does any bean indexed property.
 */
public class IndexedProperty {

   private final String _name;
   private final Method _getter;
   private final Method _setter;

   public IndexedProperty( String name, Method getter, @Nullable Method setter ) {
      _name = name;
      _getter = getter;
      _setter = setter;
   }

   public boolean canWrite() {
      return _setter != null;
   }

   public Object get( Object obj, Object... indexes ) {
      return Invoker.invoke(_getter, obj, indexes);
   }

   public Class<?>[] getIndexTypes() {
      return _getter.getParameterTypes();
   }

   public Method getGetter() {
      return _getter;
   }

   /**
    * @return the decapitalized name following <code>get</code>, or the empty string for a plain <code>get(i...)</code> indexer
    */
   public String getName() {
      return _name;
   }

   @Nullable
   public Method getSetter() {
      return _setter;
   }

   public Class<?> getType() {
      return _getter.getReturnType();
   }

   public void set( Object obj, @Nullable Object value, Object... indexes ) {
      if ( _setter == null ) {
         throw new IllegalStateException("Indexer " + this + " has no setter.");
      }
      Invoker.invoke(_setter, obj, ObjectArrays.concat(indexes, value));
   }

   @Override
   public String toString() {
      return _getter.getDeclaringClass().getSimpleName() + "." + _getter.getName() + Arrays.toString(getIndexTypes());
   }
}
