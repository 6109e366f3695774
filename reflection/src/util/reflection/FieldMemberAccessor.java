package util.reflection;

import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;

import javax.annotation.Nullable;


public class FieldMemberAccessor implements MemberAccessor {

   private final Field _field;

   public FieldMemberAccessor( Field field ) {
      _field = field;
   }

   @Override
   public Object get( @Nullable Object obj ) {
      return Invoker.get(_field, obj);
   }

   @Override
   public Class<?> getDeclaringClass() {
      return _field.getDeclaringClass();
   }

   public Field getField() {
      return _field;
   }

   @Override
   public Type getGenericType() {
      return _field.getGenericType();
   }

   @Override
   public Member getMember() {
      return _field;
   }

   @Override
   public String getName() {
      return _field.getName();
   }

   @Override
   public Class<?> getType() {
      return _field.getType();
   }

   @Override
   public boolean isStatic() {
      return Modifier.isStatic(_field.getModifiers());
   }

   @Override
   public void set( @Nullable Object obj, @Nullable Object value ) {
      Invoker.set(_field, obj, value);
   }

   @Override
   public String toString() {
      return "field " + _field.getDeclaringClass().getSimpleName() + "." + _field.getName();
   }
}
