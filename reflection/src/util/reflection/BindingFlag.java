package util.reflection;

/**
 * A single criterion of a {@link Binding}. A member is eligible when both its visibility flag and its static-ness flag are part of the binding.
 */
public enum BindingFlag {

   PUBLIC("Public"),
   NON_PUBLIC("NonPublic"),
   INSTANCE("Instance"),
   STATIC("Static");

   private final String _displayName;

   BindingFlag( String displayName ) {
      _displayName = displayName;
   }

   public String getDisplayName() {
      return _displayName;
   }
}
