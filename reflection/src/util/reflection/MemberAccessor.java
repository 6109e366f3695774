package util.reflection;

import java.lang.reflect.Member;
import java.lang.reflect.Type;

import javax.annotation.Nullable;


/**
 * Read/write view over a named value of a type, either a field or a property.
 * <p>
 * The receiver is <code>null</code> for static members.
 */
public interface MemberAccessor {

   Object get( @Nullable Object obj );

   Class<?> getDeclaringClass();

   /**
    * @return the underlying field, or the getter (falling back to the setter) of a property
    */
   Member getMember();

   String getName();

   Class<?> getType();

   Type getGenericType();

   boolean isStatic();

   void set( @Nullable Object obj, @Nullable Object value );
}
